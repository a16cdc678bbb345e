package tosk;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * EncryptionUtils
 * ----------------
 * Password-based key derivation and the self-contained AES-GCM envelope used for both the
 * local secret store and backup payloads.
 * - Derives a 256-bit AES key from a passphrase using PBKDF2 (HMAC-SHA-256, 100,000 iterations).
 * - Every seal draws a fresh 16-byte salt and 12-byte nonce from {@link SecureRandom}, so a
 *   (key, nonce) pair never repeats.
 *
 * Envelope layout:
 *   salt(16) | nonce(12) | ciphertext | tag(16)
 *
 * Notes:
 *  - Nothing besides the passphrase is needed to open an envelope.
 *  - The key derivation cost is paid on every seal and every open.
 *  - Derived key bytes are wiped as soon as the cipher is initialized and used.
 */
public final class EncryptionUtils {

    private static final String ENCRYPTION_ALGO = "AES";                   // symmetric cipher algorithm
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";      // authenticated mode, no padding needed
    private static final String DERIVATION_ALGO = "PBKDF2WithHmacSHA256";  // password -> key derivation

    public static final int SALT_LENGTH = 16;
    public static final int NONCE_LENGTH = 12;
    public static final int HEADER_LENGTH = SALT_LENGTH + NONCE_LENGTH;
    public static final int KEY_LENGTH_BYTES = 32;
    public static final int ITERATIONS = 100_000;
    private static final int TAG_LENGTH_BITS = 128;

    private static final SecureRandom RANDOM = new SecureRandom();

    private EncryptionUtils() {}

    /**
     * Derive a 256-bit key from a passphrase and salt.
     * Same passphrase + same salt always give the same key.
     *
     * @param passphrase secret chars (not modified; the internal copy held by PBEKeySpec is cleared)
     * @param salt exactly {@value #SALT_LENGTH} bytes
     * @return 32 raw key bytes; callers should wipe them after use
     */
    public static byte[] deriveKey(char[] passphrase, byte[] salt) {
        if (passphrase == null) throw new IllegalArgumentException("passphrase is required");
        if (salt == null || salt.length != SALT_LENGTH) {
            throw new IllegalArgumentException("salt must be " + SALT_LENGTH + " bytes");
        }
        PBEKeySpec spec = new PBEKeySpec(passphrase, salt, ITERATIONS, KEY_LENGTH_BYTES * 8);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(DERIVATION_ALGO);
            return factory.generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 key derivation is unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Encrypt bytes into a fresh envelope.
     * Steps:
     *  1. Draw a random salt and nonce.
     *  2. Derive the key from passphrase + salt.
     *  3. AES-GCM encrypt (no associated data) and prepend salt and nonce.
     */
    public static byte[] seal(byte[] plaintext, char[] passphrase) {
        if (plaintext == null) throw new IllegalArgumentException("plaintext is required");

        byte[] salt = new byte[SALT_LENGTH];
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(salt);
        RANDOM.nextBytes(nonce);

        byte[] key = deriveKey(passphrase, salt);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, ENCRYPTION_ALGO),
                    new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            byte[] ctTag = cipher.doFinal(plaintext); // ciphertext || 16B tag

            return ByteBuffer.allocate(HEADER_LENGTH + ctTag.length)
                    .put(salt)
                    .put(nonce)
                    .put(ctTag)
                    .array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Verify and decrypt an envelope produced by {@link #seal(byte[], char[])}.
     * No plaintext is returned unless the tag verifies.
     *
     * @throws EnvelopeFormatException if the envelope is shorter than the salt + nonce header
     * @throws AuthenticationFailedException on wrong passphrase or a tampered/corrupted envelope
     */
    public static byte[] open(byte[] envelope, char[] passphrase)
            throws EnvelopeFormatException, AuthenticationFailedException {
        if (envelope == null || envelope.length < HEADER_LENGTH) {
            throw new EnvelopeFormatException("Envelope is shorter than the "
                    + HEADER_LENGTH + "-byte header");
        }
        byte[] salt = Arrays.copyOfRange(envelope, 0, SALT_LENGTH);
        byte[] nonce = Arrays.copyOfRange(envelope, SALT_LENGTH, HEADER_LENGTH);

        byte[] key = deriveKey(passphrase, salt);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, ENCRYPTION_ALGO),
                    new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return cipher.doFinal(envelope, HEADER_LENGTH, envelope.length - HEADER_LENGTH); // throws on tamper
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException("Authentication tag did not verify", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /** Seal and encode the envelope as Base64 text (secret-store file format). */
    public static String sealToBase64(byte[] plaintext, char[] passphrase) {
        return Base64.getEncoder().encodeToString(seal(plaintext, passphrase));
    }

    /** Decode Base64 text (surrounding whitespace ignored) and open the envelope inside it. */
    public static byte[] openFromBase64(String text, char[] passphrase)
            throws EnvelopeFormatException, AuthenticationFailedException {
        if (text == null) throw new EnvelopeFormatException("Envelope text is missing");
        byte[] envelope;
        try {
            envelope = Base64.getDecoder().decode(text.strip());
        } catch (IllegalArgumentException e) {
            throw new EnvelopeFormatException("Envelope is not valid Base64", e);
        }
        return open(envelope, passphrase);
    }

    /** Copy a String secret into a char[] that callers can wipe once done. */
    public static char[] toChars(String secret) {
        return secret == null ? new char[0] : secret.toCharArray();
    }
}
