package com.fabtrack.api.ledger;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Signatures travel as {@code data:image/<type>;base64,<payload>} URLs and are stored as raw bytes. */
public final class SignatureCodec {

  private static final Pattern DATA_URL = Pattern.compile("^data:image/[\\w.+-]+;base64,(.*)$", Pattern.DOTALL);

  private SignatureCodec() {
  }

  public static String encode(byte[] data) {
    if (data == null || data.length == 0) return null;
    return "data:image/png;base64," + Base64.getEncoder().encodeToString(data);
  }

  /** Blank input decodes to {@code null}. */
  public static byte[] decode(String dataUrl) {
    if (dataUrl == null || dataUrl.isBlank()) return null;
    Matcher m = DATA_URL.matcher(dataUrl.trim());
    if (!m.matches()) {
      throw new JobValidationException("Signature must be a data:image/...;base64 URL", 422);
    }
    try {
      return Base64.getMimeDecoder().decode(m.group(1));
    } catch (IllegalArgumentException ex) {
      throw new JobValidationException("Signature is not valid base64", 422);
    }
  }
}
