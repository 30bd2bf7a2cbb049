package io.b2mash.orgaccess.util;

/** Masks email addresses before they are shown in messages or written to logs. */
public final class EmailMasking {

  private EmailMasking() {}

  /**
   * Keeps the first and last character of the local part and the whole domain: {@code
   * alice@example.com} becomes {@code a***e@example.com}. Local parts of one or two letters keep
   * only their first letter, or none, so at least one character is always hidden.
   *
   * @throws IllegalArgumentException if the value has no {@code @}
   */
  public static String mask(String email) {
    int at = email == null ? -1 : email.indexOf('@');
    if (at == -1) {
      throw new IllegalArgumentException("Please provide a valid email address.");
    }
    if (at <= 1) {
      return "*" + email.substring(at);
    }
    if (at == 2) {
      return email.charAt(0) + "*" + email.substring(at);
    }
    return email.charAt(0) + "*".repeat(at - 2) + email.substring(at - 1);
  }
}
