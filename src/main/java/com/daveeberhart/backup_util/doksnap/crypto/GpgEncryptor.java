package com.daveeberhart.backup_util.doksnap.crypto;

import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

import org.apache.commons.io.FileUtils;
import org.bouncycastle.bcpg.SymmetricKeyAlgorithmTags;
import org.bouncycastle.openpgp.PGPEncryptedDataGenerator;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPLiteralDataGenerator;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPPublicKeyRingCollection;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.operator.bc.BcKeyFingerprintCalculator;
import org.bouncycastle.openpgp.operator.bc.BcPGPDataEncryptorBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPublicKeyKeyEncryptionMethodGenerator;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.error.JobFailedException.EncryptionException;
import com.daveeberhart.backup_util.doksnap.progress.CryptoProgressListener;

/**
 * OpenPGP public-key encryption, as {@code gpg --encrypt --recipient ...} would produce.
 * <p>
 * Recipient selection:
 * <ol>
 * <li>If the keyring has no usable encryption key, the configured armored public key is imported first.
 *     If that still yields no usable key, encryption fails.</li>
 * <li>With an explicit key id, the key whose fingerprint, long id or short id matches is used, or we fail.</li>
 * <li>Otherwise keys are ordered by primary-key fingerprint and the first one wins.  Keyring
 *     iteration order is not trusted.</li>
 * </ol>
 * Keys are never trusted implicitly: only keys that were actually imported, unrevoked and
 * unexpired, are used.
 *
 * @author deberhar
 */
public class GpgEncryptor implements Encryptor {
  private static final Logger logger = LoggerFactory.getLogger(GpgEncryptor.class);
  private static final int BUFFER_SIZE = 64 * 1024;

  private static final SecureRandom random = new SecureRandom();

  private final String armoredPublicKey;
  private final String keyId;
  private PGPPublicKeyRingCollection keyring;

  public GpgEncryptor(String p_armoredPublicKey, String p_keyId) {
    this(p_armoredPublicKey, p_keyId, null);
  }

  /**
   * @param p_armoredPublicKey Key to import when the keyring has nothing usable; may be null if the keyring has it.
   * @param p_keyId Explicit recipient (fingerprint, 16-digit or 8-digit key id), or null to pick one.
   * @param p_keyringFile Public keyring to start from, or null to start empty.
   */
  public GpgEncryptor(String p_armoredPublicKey, String p_keyId, Path p_keyringFile) {
    armoredPublicKey = p_armoredPublicKey;
    keyId = p_keyId == null ? null : normalizeKeyId(p_keyId);
    keyring = p_keyringFile == null ? emptyKeyring() : loadKeyring(p_keyringFile);
  }

  @Override
  public EncryptionMethod getMethod() {
    return EncryptionMethod.GPG;
  }

  @Override
  public void encrypt(Path p_in, Path p_out) {
    PGPPublicKey recipient = selectRecipient();

    PGPEncryptedDataGenerator generator = new PGPEncryptedDataGenerator(
        new BcPGPDataEncryptorBuilder(SymmetricKeyAlgorithmTags.AES_256)
            .setWithIntegrityPacket(true)
            .setSecureRandom(random));
    generator.addMethod(new BcPublicKeyKeyEncryptionMethodGenerator(recipient));

    try (OutputStream fout = new BufferedOutputStream(Files.newOutputStream(p_out));
         OutputStream encOut = generator.open(fout, new byte[BUFFER_SIZE])) {
      PGPLiteralDataGenerator literal = new PGPLiteralDataGenerator();
      Date modified = new Date(Files.getLastModifiedTime(p_in).toMillis());
      CryptoProgressListener listener = new CryptoProgressListener(p_in.getFileName().toString(), "Encrypt", Files.size(p_in));
      try (OutputStream litOut = literal.open(encOut, PGPLiteralData.BINARY, p_in.getFileName().toString(), modified, new byte[BUFFER_SIZE]);
           InputStream fin = Files.newInputStream(p_in)) {
        final byte[] buff = new byte[BUFFER_SIZE];
        int len;
        while ((len = fin.read(buff, 0, buff.length)) >= 0) {
          litOut.write(buff, 0, len);
          listener.addBytesProcessed(len);
        }
      }
      listener.done();
    } catch (IOException | PGPException e) {
      FileUtils.deleteQuietly(p_out.toFile());
      throw new EncryptionException("GPG encryption failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      FileUtils.deleteQuietly(p_out.toFile());
      throw e;
    }
  }

  /**
   * Pick the recipient key, importing the configured key first if needed.
   */
  synchronized PGPPublicKey selectRecipient() {
    List<PGPPublicKeyRing> candidates = usableRings();
    if (candidates.isEmpty() || (keyId != null && findByKeyId(candidates) == null)) {
      importPublicKey();
      candidates = usableRings();
    }

    if (candidates.isEmpty()) {
      throw new EncryptionException("No usable GPG public key found. Please import a valid public key.");
    }

    PGPPublicKeyRing chosen;
    if (keyId != null) {
      chosen = findByKeyId(candidates);
      if (chosen == null) {
        throw new EncryptionException("Configured GPG key id " + keyId + " does not match any imported key");
      }
    } else {
      candidates.sort(Comparator.comparing(ring -> fingerprint(ring.getPublicKey())));
      chosen = candidates.get(0);
      if (candidates.size() > 1) {
        logger.warn("{} GPG keys available and no key id configured; encrypting to {}", candidates.size(), fingerprint(chosen.getPublicKey()));
      }
    }

    return encryptionKey(chosen);
  }

  private void importPublicKey() {
    if (armoredPublicKey == null || armoredPublicKey.trim().isEmpty()) {
      return;
    }

    PGPPublicKeyRingCollection imported = readKeyrings(new ByteArrayInputStream(armoredPublicKey.getBytes(StandardCharsets.US_ASCII)));
    int count = 0;
    for (PGPPublicKeyRing ring : imported) {
      if (!keyring.contains(ring.getPublicKey().getKeyID())) {
        keyring = PGPPublicKeyRingCollection.addPublicKeyRing(keyring, ring);
        count++;
      }
    }

    if (imported.size() == 0) {
      throw new EncryptionException("Failed to import GPG public key. Invalid key format.");
    }
    logger.info("Imported {} GPG public key(s)", count);
  }

  private List<PGPPublicKeyRing> usableRings() {
    List<PGPPublicKeyRing> rings = new ArrayList<>();
    for (PGPPublicKeyRing ring : keyring) {
      if (encryptionKeyOrNull(ring) != null) {
        rings.add(ring);
      }
    }
    return rings;
  }

  private PGPPublicKeyRing findByKeyId(List<PGPPublicKeyRing> p_rings) {
    for (PGPPublicKeyRing ring : p_rings) {
      for (Iterator<PGPPublicKey> it = ring.getPublicKeys(); it.hasNext(); ) {
        PGPPublicKey key = it.next();
        String fp = fingerprint(key);
        String longId = String.format(Locale.ROOT, "%016X", key.getKeyID());
        if (keyId.equals(fp) || keyId.equals(longId) || keyId.equals(longId.substring(8))) {
          return ring;
        }
      }
    }
    return null;
  }

  private static PGPPublicKey encryptionKey(PGPPublicKeyRing p_ring) {
    PGPPublicKey key = encryptionKeyOrNull(p_ring);
    if (key == null) {
      throw new EncryptionException("GPG key " + fingerprint(p_ring.getPublicKey()) + " has no usable encryption key");
    }
    return key;
  }

  /**
   * Prefer an encryption subkey (what gpg does), falling back to an encryption-capable primary key.
   */
  private static PGPPublicKey encryptionKeyOrNull(PGPPublicKeyRing p_ring) {
    PGPPublicKey primary = null;
    for (Iterator<PGPPublicKey> it = p_ring.getPublicKeys(); it.hasNext(); ) {
      PGPPublicKey key = it.next();
      if (!isUsable(key)) {
        continue;
      }
      if (!key.isMasterKey()) {
        return key;
      }
      primary = key;
    }
    return primary;
  }

  private static boolean isUsable(PGPPublicKey p_key) {
    if (!p_key.isEncryptionKey() || p_key.hasRevocation()) {
      return false;
    }
    long validSeconds = p_key.getValidSeconds();
    return validSeconds <= 0 || p_key.getCreationTime().getTime() + validSeconds * 1000L > System.currentTimeMillis();
  }

  static String fingerprint(PGPPublicKey p_key) {
    return Hex.toHexString(p_key.getFingerprint()).toUpperCase(Locale.ROOT);
  }

  private static String normalizeKeyId(String p_keyId) {
    String id = p_keyId.replace(" ", "").toUpperCase(Locale.ROOT);
    return id.startsWith("0X") ? id.substring(2) : id;
  }

  private static PGPPublicKeyRingCollection emptyKeyring() {
    try {
      return new PGPPublicKeyRingCollection(new ByteArrayInputStream(new byte[0]), new BcKeyFingerprintCalculator());
    } catch (IOException | PGPException e) {
      throw new IllegalStateException("Cannot create an empty keyring?!", e);
    }
  }

  private static PGPPublicKeyRingCollection loadKeyring(Path p_keyringFile) {
    try (InputStream in = Files.newInputStream(p_keyringFile)) {
      return readKeyrings(in);
    } catch (IOException e) {
      throw new EncryptionException("Could not read GPG keyring " + p_keyringFile.getFileName() + ": " + e.getMessage(), e);
    }
  }

  private static PGPPublicKeyRingCollection readKeyrings(InputStream p_in) {
    try (InputStream decoded = PGPUtil.getDecoderStream(p_in)) {
      return new PGPPublicKeyRingCollection(decoded, new BcKeyFingerprintCalculator());
    } catch (IOException | PGPException e) {
      throw new EncryptionException("GPG key import failed: " + e.getMessage(), e);
    }
  }

}
