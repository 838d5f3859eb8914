package de.ialistannen.ocmirror.image;

import java.util.Objects;

/**
 * The platform of an entry in a manifest list.
 *
 * @param os the operating system, e.g. {@code linux}
 * @param architecture the architecture, e.g. {@code amd64}
 * @param variant the optional cpu variant, may be null
 */
public record Platform(String os, String architecture, String variant) {

  public static final Platform LINUX_AMD64 = new Platform("linux", "amd64", null);

  /**
   * Parses {@code os/architecture[/variant]}.
   *
   * @param asString the platform string
   * @return the platform
   */
  public static Platform parse(String asString) {
    String[] parts = asString.split("/");
    if (parts.length < 2 || parts.length > 3) {
      throw new IllegalArgumentException("Platform must look like 'os/arch[/variant]', got '" + asString + "'");
    }
    return new Platform(parts[0], parts[1], parts.length == 3 ? parts[2] : null);
  }

  /**
   * @param other the platform of a manifest list entry
   * @return true if the other platform satisfies this one. A variant is only compared if this platform has one.
   */
  public boolean matches(Platform other) {
    if (other == null) {
      return false;
    }
    if (!os.equals(other.os()) || !architecture.equals(other.architecture())) {
      return false;
    }
    return variant == null || Objects.equals(variant, other.variant());
  }

  @Override
  public String toString() {
    return os + "/" + architecture + (variant != null ? "/" + variant : "");
  }
}
