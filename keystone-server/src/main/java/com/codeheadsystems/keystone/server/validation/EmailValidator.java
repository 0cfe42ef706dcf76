package com.codeheadsystems.keystone.server.validation;

import java.util.regex.Pattern;

/**
 * Syntactic email check used for account identifiers.
 * <p>
 * Accepts {@code local-part@domain.label} where the domain contains at least one dot and the
 * final label is alphabetic with at least two characters. No DNS or mailbox verification.
 */
public final class EmailValidator {

  private static final Pattern EMAIL =
      Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

  private EmailValidator() {
  }

  /**
   * Is valid email boolean.
   *
   * @param candidate the candidate, may be null
   * @return true if the candidate has the shape of an email address
   */
  public static boolean isValidEmail(String candidate) {
    return candidate != null && EMAIL.matcher(candidate).matches();
  }
}
