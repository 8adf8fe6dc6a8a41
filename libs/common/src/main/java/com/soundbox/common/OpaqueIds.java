/*
 * Where: Shared utilities
 * What: Generates externally visible opaque identifiers and device credentials
 * Why: Keep the id formats stable in one place for every caller
 */
package com.soundbox.common;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

public final class OpaqueIds {

  private static final String DEVICE_TOKEN_PREFIX = "sb_";
  private static final int DEVICE_TOKEN_BYTES = 16;
  private static final SecureRandom RANDOM = new SecureRandom();

  private OpaqueIds() {}

  public static String newTransactionId() {
    return UUID.randomUUID().toString();
  }

  /** {@code sb_} followed by 32 lower-case hex characters. */
  public static String newDeviceToken() {
    final byte[] bytes = new byte[DEVICE_TOKEN_BYTES];
    RANDOM.nextBytes(bytes);
    return DEVICE_TOKEN_PREFIX + HexFormat.of().formatHex(bytes);
  }
}
