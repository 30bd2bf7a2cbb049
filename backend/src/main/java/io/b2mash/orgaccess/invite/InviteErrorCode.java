package io.b2mash.orgaccess.invite;

/** Machine-readable reasons an invite cannot be redeemed. Callers branch on these, not on text. */
public enum InviteErrorCode {
  INVALID_RECIPIENT("invalid_recipient"),
  EXPIRED("expired"),
  USER_ALREADY_MEMBER("user_already_member"),
  EXISTING_EMAIL_ADDRESS("existing_email_address");

  private final String code;

  InviteErrorCode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
