package com.example.opcuaagent.util;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Security;
import java.security.cert.X509Certificate;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

/**
 * Loads PEM certificates and private keys with BouncyCastle.
 */
public final class PemFiles {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private PemFiles() {
    }

    public static X509Certificate loadCertificate(Path file) throws IOException, GeneralSecurityException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.US_ASCII);
             PEMParser reader = new PEMParser(in)) {
            Object object = reader.readObject();
            if (!(object instanceof X509CertificateHolder)) {
                throw new IOException(file + " does not contain a PEM certificate");
            }
            return new JcaX509CertificateConverter().setProvider(BouncyCastleProvider.PROVIDER_NAME)
                    .getCertificate((X509CertificateHolder) object);
        }
    }

    /**
     * Loads a private key from a PEM file: PKCS#1 key pairs, PKCS#8 and encrypted PKCS#8.
     *
     * @param password password of an encrypted key; may be null for unencrypted keys
     */
    public static PrivateKey loadPrivateKey(Path file, char[] password) throws IOException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.US_ASCII);
             PEMParser reader = new PEMParser(in)) {
            Object object = reader.readObject();
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(BouncyCastleProvider.PROVIDER_NAME);

            if (object instanceof PEMKeyPair) {
                return converter.getPrivateKey(((PEMKeyPair) object).getPrivateKeyInfo());
            }
            if (object instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) object);
            }
            if (object instanceof PKCS8EncryptedPrivateKeyInfo) {
                if (password == null) {
                    throw new IOException(file + " is encrypted but no password is configured");
                }
                try {
                    return converter.getPrivateKey(((PKCS8EncryptedPrivateKeyInfo) object)
                            .decryptPrivateKeyInfo(new JceOpenSSLPKCS8DecryptorProviderBuilder().build(password)));
                } catch (OperatorCreationException | PKCSException e) {
                    throw new IOException("Cannot decrypt " + file, e);
                }
            }
        }
        throw new IOException(file + " does not contain a supported PEM private key");
    }
}
