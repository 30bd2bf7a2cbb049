package io.b2mash.orgaccess.membership;

/**
 * Ordinal permission rank inside an organization. The numeric value is what gets persisted and
 * compared; gaps leave room for levels in between.
 */
public enum MembershipLevel {
  MEMBER(1, "member"),
  ADMIN(8, "administrator"),
  OWNER(15, "owner");

  private final int value;
  private final String label;

  MembershipLevel(int value, String label) {
    this.value = value;
    this.label = label;
  }

  public int value() {
    return value;
  }

  public String label() {
    return label;
  }

  public boolean isAtLeast(MembershipLevel other) {
    return value >= other.value;
  }

  public boolean isHigherThan(MembershipLevel other) {
    return value > other.value;
  }

  public static MembershipLevel fromValue(int value) {
    for (MembershipLevel level : values()) {
      if (level.value == value) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown membership level: " + value);
  }
}
