package io.b2mash.orgaccess.membership;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class MembershipLevelTest {

  private final MembershipLevelConverter converter = new MembershipLevelConverter();

  @Test
  void levelsAreOrderedByValue() {
    assertThat(MembershipLevel.OWNER.isHigherThan(MembershipLevel.ADMIN)).isTrue();
    assertThat(MembershipLevel.ADMIN.isAtLeast(MembershipLevel.ADMIN)).isTrue();
    assertThat(MembershipLevel.MEMBER.isAtLeast(MembershipLevel.ADMIN)).isFalse();
  }

  @Test
  void converterStoresNumericValue() {
    assertThat(converter.convertToDatabaseColumn(MembershipLevel.OWNER)).isEqualTo((short) 15);
    assertThat(converter.convertToEntityAttribute((short) 8)).isEqualTo(MembershipLevel.ADMIN);
    assertThat(converter.convertToEntityAttribute(null)).isNull();
  }

  @Test
  void unknownValueIsRejected() {
    assertThatThrownBy(() -> MembershipLevel.fromValue(3))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
