/*
 * Copyright 2024 Responsive Computing, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.athenz.syncer.zms.auth;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

/**
 * Reads PEM encoded private keys and certificate chains into a {@link CredentialBundle}.
 */
public final class PemCredentials {
  private static final SecureRandom RANDOM = new SecureRandom();

  private PemCredentials() {
  }

  public static CredentialBundle load(final Path keyFile, final Path certFile, final Instant now) {
    final PrivateKey privateKey = readPrivateKey(keyFile);
    final X509Certificate[] chain = readCertificateChain(certFile);
    verifyKeyPair(privateKey, chain[0]);
    return new CredentialBundle(privateKey, chain, now);
  }

  static PrivateKey readPrivateKey(final Path keyFile) {
    try (Reader reader = Files.newBufferedReader(keyFile, StandardCharsets.UTF_8);
         PEMParser parser = new PEMParser(reader)) {
      final JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
      Object object;
      while ((object = parser.readObject()) != null) {
        if (object instanceof PEMKeyPair) {
          return converter.getKeyPair((PEMKeyPair) object).getPrivate();
        }
        if (object instanceof PrivateKeyInfo) {
          return converter.getPrivateKey((PrivateKeyInfo) object);
        }
        if (object instanceof PEMEncryptedKeyPair
            || object instanceof PKCS8EncryptedPrivateKeyInfo) {
          throw new InvalidCredentialsException("encrypted private keys are not supported: "
              + keyFile);
        }
        // EC PARAMETERS blocks precede the key in openssl output
      }
    } catch (final IOException e) {
      throw new InvalidCredentialsException("could not read private key " + keyFile, e);
    }
    throw new InvalidCredentialsException("no private key found in " + keyFile);
  }

  static X509Certificate[] readCertificateChain(final Path certFile) {
    final List<X509Certificate> chain = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(certFile, StandardCharsets.UTF_8);
         PEMParser parser = new PEMParser(reader)) {
      final JcaX509CertificateConverter converter = new JcaX509CertificateConverter();
      Object object;
      while ((object = parser.readObject()) != null) {
        if (object instanceof X509CertificateHolder) {
          chain.add(converter.getCertificate((X509CertificateHolder) object));
        }
      }
    } catch (final IOException | CertificateException e) {
      throw new InvalidCredentialsException("could not read certificate " + certFile, e);
    }
    if (chain.isEmpty()) {
      throw new InvalidCredentialsException("no certificate found in " + certFile);
    }
    return chain.toArray(new X509Certificate[0]);
  }

  /**
   * Signs a random challenge with the private key and checks it against the leaf certificate.
   * A key rotated on disk before its certificate (or the other way round) fails here.
   */
  static void verifyKeyPair(final PrivateKey privateKey, final X509Certificate certificate) {
    final String algorithm = signatureAlgorithm(privateKey);
    final byte[] challenge = new byte[32];
    RANDOM.nextBytes(challenge);
    try {
      final Signature signer = Signature.getInstance(algorithm);
      signer.initSign(privateKey);
      signer.update(challenge);
      final byte[] signature = signer.sign();

      final Signature verifier = Signature.getInstance(algorithm);
      verifier.initVerify(certificate.getPublicKey());
      verifier.update(challenge);
      if (!verifier.verify(signature)) {
        throw new InvalidCredentialsException(
            "private key does not match certificate " + certificate.getSubjectX500Principal());
      }
    } catch (final GeneralSecurityException e) {
      throw new InvalidCredentialsException(
          "could not verify private key against certificate "
              + certificate.getSubjectX500Principal(), e);
    }
  }

  private static String signatureAlgorithm(final PrivateKey privateKey) {
    switch (privateKey.getAlgorithm()) {
      case "RSA":
        return "SHA256withRSA";
      case "EC":
      case "ECDSA":
        return "SHA256withECDSA";
      case "Ed25519":
      case "EdDSA":
        return "Ed25519";
      default:
        throw new InvalidCredentialsException(
            "unsupported private key algorithm " + privateKey.getAlgorithm());
    }
  }
}
