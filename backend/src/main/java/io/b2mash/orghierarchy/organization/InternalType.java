package io.b2mash.orghierarchy.organization;

/**
 * How an organization relates to its parent. Affiliated organizations are always ordered before
 * normal ones among siblings.
 */
public enum InternalType {
  AFFILIATED,
  NORMAL;

  /** Parses the lowercase wire form ("normal", "affiliated") as well as the enum name. */
  public static InternalType fromValue(String value) {
    for (InternalType type : values()) {
      if (type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown internal type: " + value);
  }

  int siblingRank() {
    return this == AFFILIATED ? 0 : 1;
  }
}
