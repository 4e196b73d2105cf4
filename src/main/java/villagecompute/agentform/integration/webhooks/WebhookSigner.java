package villagecompute.agentform.integration.webhooks;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * HMAC-SHA256 signatures for outbound webhook bodies, sent in {@value #SIGNATURE_HEADER} as lowercase hex.
 *
 * <p>
 * Receivers recompute the HMAC over the raw request body with the shared secret and compare it with the header.
 */
public final class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Signature";

    private static final String HMAC_SHA256 = "HmacSHA256";

    private WebhookSigner() {
        // Utility class, no instantiation
    }

    /**
     * @return lowercase hex HMAC-SHA256 of {@code body} keyed with {@code secret}
     */
    public static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            byte[] hash = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));

            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                String h = Integer.toHexString(0xff & b);
                if (h.length() == 1) {
                    hex.append('0');
                }
                hex.append(h);
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute webhook signature", e);
        }
    }

    /**
     * Constant-time check of a received signature.
     */
    public static boolean verify(String secret, String body, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = sign(secret, body).getBytes(StandardCharsets.UTF_8);
        byte[] received = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, received);
    }
}
