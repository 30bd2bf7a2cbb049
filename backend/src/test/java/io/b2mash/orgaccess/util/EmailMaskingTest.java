package io.b2mash.orgaccess.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class EmailMaskingTest {

  @Test
  void keepsFirstAndLastCharacterOfLocalPart() {
    assertThat(EmailMasking.mask("alice@example.com")).isEqualTo("a***e@example.com");
  }

  @Test
  void twoLetterLocalPartHidesSecondLetter() {
    assertThat(EmailMasking.mask("al@example.com")).isEqualTo("a*@example.com");
  }

  @Test
  void threeLetterLocalPartHidesMiddleLetter() {
    assertThat(EmailMasking.mask("bob@example.com")).isEqualTo("b*b@example.com");
  }

  @Test
  void oneLetterLocalPartIsReplacedByAsterisk() {
    assertThat(EmailMasking.mask("a@example.com")).isEqualTo("*@example.com");
  }

  @Test
  void rejectsValueWithoutAtSign() {
    assertThatThrownBy(() -> EmailMasking.mask("not-an-email"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
