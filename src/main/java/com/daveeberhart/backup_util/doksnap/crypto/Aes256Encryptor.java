package com.daveeberhart.backup_util.doksnap.crypto;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

import org.apache.commons.io.FileUtils;
import org.bouncycastle.crypto.BufferedBlockCipher;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

import com.daveeberhart.backup_util.doksnap.error.JobFailedException.EncryptionException;
import com.daveeberhart.backup_util.doksnap.progress.CryptoProgressListener;

/**
 * Passphrase-based AES-256-CBC.
 * <p>
 * The file format is:
 * <ul>
 * <li>A 4-byte big-endian salt length, then that many bytes of salt ({@value #SALT_SIZE_BYTES} when we write it)</li>
 * <li>A 4-byte big-endian IV length, then that many bytes of IV ({@value #IV_SIZE_BYTES} when we write it)</li>
 * <li>The archive, encrypted with AES-256-CBC and PKCS#7 padding.  The key is derived from the
 *     passphrase and salt with PBKDF2-HMAC-SHA256, {@value #PBKDF2_ITERATIONS} iterations.</li>
 * </ul>
 * Salt and IV are fresh for every file, so the header is all that's needed to decrypt.
 *
 * @author deberhar
 */
public class Aes256Encryptor implements Encryptor {
  static final int PBKDF2_ITERATIONS = 100_000;
  static final int SALT_SIZE_BYTES = 16;
  static final int IV_SIZE_BYTES = 16;
  private static final int KEY_SIZE_BITS = 256;
  private static final int CHUNK_SIZE = 4 * 1024;
  /** Anything bigger than this in a length field means we're not reading one of our files. */
  private static final int MAX_HEADER_FIELD_BYTES = 1024;

  private static final SecureRandom random = new SecureRandom();

  private final String password;

  public Aes256Encryptor(String p_password) {
    if (p_password == null || p_password.isEmpty()) {
      throw new IllegalArgumentException("An encryption password is required");
    }
    password = p_password;
  }

  @Override
  public EncryptionMethod getMethod() {
    return EncryptionMethod.AES256;
  }

  @Override
  public void encrypt(Path p_in, Path p_out) {
    byte[] salt = new byte[SALT_SIZE_BYTES];
    random.nextBytes(salt);
    byte[] iv = new byte[IV_SIZE_BYTES];
    random.nextBytes(iv);

    try (InputStream fin = new BufferedInputStream(Files.newInputStream(p_in));
         DataOutputStream fout = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(p_out)))) {
      fout.writeInt(salt.length);
      fout.write(salt);
      fout.writeInt(iv.length);
      fout.write(iv);

      BufferedBlockCipher cipher = createCipher(deriveKey(salt), iv, true);
      CryptoProgressListener listener = new CryptoProgressListener(p_in.getFileName().toString(), "Encrypt", Files.size(p_in));
      streamThrough(cipher, fin, fout, listener);
      listener.done();
    } catch (IOException | DataLengthException | InvalidCipherTextException e) {
      FileUtils.deleteQuietly(p_out.toFile());
      throw new EncryptionException("AES-256 encryption failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      FileUtils.deleteQuietly(p_out.toFile());
      throw e;
    }
  }

  /**
   * Decrypt a file written by {@link #encrypt(Path, Path)}.
   *
   * @throws EncryptionException if the header is malformed, the passphrase is wrong, or the file is corrupt.
   */
  public void decrypt(Path p_in, Path p_out) {
    try (DataInputStream fin = new DataInputStream(new BufferedInputStream(Files.newInputStream(p_in)));
         OutputStream fout = new BufferedOutputStream(Files.newOutputStream(p_out))) {
      byte[] salt = readHeaderField(fin, "salt");
      byte[] iv = readHeaderField(fin, "IV");
      if (iv.length != IV_SIZE_BYTES) {
        throw new EncryptionException(p_in.getFileName() + " has an IV of " + iv.length + " bytes; expected " + IV_SIZE_BYTES);
      }

      BufferedBlockCipher cipher = createCipher(deriveKey(salt), iv, false);
      CryptoProgressListener listener = new CryptoProgressListener(p_in.getFileName().toString(), "Decrypt", Files.size(p_in));
      streamThrough(cipher, fin, fout, listener);
      listener.done();
    } catch (InvalidCipherTextException | DataLengthException e) {
      FileUtils.deleteQuietly(p_out.toFile()); // Don't leave garbage plaintext lying about.
      throw new EncryptionException(p_in.getFileName() + " could not be decrypted (wrong password, or the file is corrupt)", e);
    } catch (IOException e) {
      FileUtils.deleteQuietly(p_out.toFile());
      throw new EncryptionException("AES-256 decryption failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      FileUtils.deleteQuietly(p_out.toFile());
      throw e;
    }
  }

  private static byte[] readHeaderField(DataInputStream p_in, String p_name) throws IOException {
    int len = p_in.readInt();
    if (len <= 0 || len > MAX_HEADER_FIELD_BYTES) {
      throw new EncryptionException("Not an AES-256 backup file (bad " + p_name + " length " + len + ")");
    }
    byte[] field = new byte[len];
    p_in.readFully(field);
    return field;
  }

  private static void streamThrough(BufferedBlockCipher p_cipher, InputStream p_in, OutputStream p_out, CryptoProgressListener p_listener)
      throws IOException, InvalidCipherTextException {
    final byte[] inbuff = new byte[CHUNK_SIZE];
    final byte[] outbuff = new byte[p_cipher.getOutputSize(CHUNK_SIZE) + 2 * p_cipher.getBlockSize()];
    int lenIn;
    while ((lenIn = p_in.read(inbuff, 0, inbuff.length)) >= 0) {
      final int lenOut = p_cipher.processBytes(inbuff, 0, lenIn, outbuff, 0);
      p_out.write(outbuff, 0, lenOut);
      p_listener.addBytesProcessed(lenIn);
    }

    final int lenFinal = p_cipher.doFinal(outbuff, 0);
    p_out.write(outbuff, 0, lenFinal);
  }

  /**
   * Derive the 256-bit file key from the passphrase using PBKDF v2 with HMAC-SHA256.
   */
  KeyParameter deriveKey(byte[] p_salt) {
    PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
    gen.init(PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password.toCharArray()), p_salt, PBKDF2_ITERATIONS);
    return (KeyParameter)gen.generateDerivedParameters(KEY_SIZE_BITS);
  }

  static BufferedBlockCipher createCipher(KeyParameter p_key, byte[] p_iv, boolean p_forEncryption) {
    PaddedBufferedBlockCipher cipher = new PaddedBufferedBlockCipher(new CBCBlockCipher(new AESEngine()), new PKCS7Padding());
    cipher.init(p_forEncryption, new ParametersWithIV(p_key, p_iv));
    return cipher;
  }

}
