package com.pdfseal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pdfseal.crypto.KeyPersistence;
import com.pdfseal.crypto.PemKeyFileStore;
import com.pdfseal.error.InvalidInputException;
import com.pdfseal.error.MalformedKeyException;
import com.pdfseal.error.NoKeyLoadedException;
import com.pdfseal.error.PdfSealException;
import com.pdfseal.pdf.TestPdfs;
import com.pdfseal.pdf.VerificationStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfSealEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-30T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private static PdfSealEngine memoryEngine() throws PdfSealException {
        return PdfSealEngine.open(new SealOptions(), KeyPersistence.NONE, CLOCK);
    }

    @Test
    void newEngineHasNoKey() throws Exception {
        PdfSealEngine engine = memoryEngine();

        assertThat(engine.hasKey()).isFalse();
        assertThatThrownBy(engine::getPublicKey).isInstanceOf(NoKeyLoadedException.class);
        assertThatThrownBy(engine::exportKey).isInstanceOf(NoKeyLoadedException.class);
        assertThatThrownBy(() -> engine.signPdf(new SignRequest(TestPdfs.simple(1), "Alice", null)))
                .isInstanceOf(NoKeyLoadedException.class);
    }

    @Test
    void signAndVerifyRoundTrip() throws Exception {
        PdfSealEngine engine = memoryEngine();
        String publicKey = engine.generateKeypair();
        assertThat(engine.getPublicKey()).isEqualTo(publicKey);

        SignResponse signed = engine.signPdf(new SignRequest(TestPdfs.simple(1), "Alice", null));
        VerifyResponse verified = engine.verifyPdf(signed.signedPdf());

        assertThat(signed.signatureInfo().signerName()).isEqualTo("Alice");
        assertThat(signed.signatureInfo().timestamp()).isEqualTo("2025-06-30T12:00:00Z");
        assertThat(signed.signatureInfo().extra()).isEmpty();
        assertThat(verified.isSigned()).isTrue();
        assertThat(verified.message()).isEqualTo("valid");
        assertThat(verified.info()).contains(signed.signatureInfo());
    }

    @Test
    void unsignedAndTamperedDocuments() throws Exception {
        PdfSealEngine engine = memoryEngine();
        engine.generateKeypair();
        byte[] signed = engine.signPdf(new SignRequest(TestPdfs.simple(1), "Alice", "Ward 3")).signedPdf();
        byte[] tampered = TestPdfs.replace(signed, TestPdfs.bodyText(1), "Page 9 body", 0);

        VerifyResponse unsigned = engine.verifyPdf(TestPdfs.simple(1));
        VerifyResponse mismatch = engine.verifyPdf(tampered);

        assertThat(unsigned.isSigned()).isFalse();
        assertThat(unsigned.signatureInfo()).isNull();
        assertThat(unsigned.message()).isEqualTo("not signed");
        assertThat(mismatch.isSigned()).isFalse();
        assertThat(mismatch.message()).isEqualTo("signature does not match content");
        assertThat(mismatch.signatureInfo().extra()).isEqualTo("Ward 3");
    }

    @Test
    void keyIsReloadedFromDisk() throws Exception {
        PemKeyFileStore store = new PemKeyFileStore(tempDir.resolve("keys"));
        PdfSealEngine first = PdfSealEngine.open(new SealOptions(), store, CLOCK);
        String publicKey = first.generateKeypair();
        byte[] signed = first.signPdf(new SignRequest(TestPdfs.simple(1), "Alice", null)).signedPdf();

        PdfSealEngine second = PdfSealEngine.open(new SealOptions(), store, CLOCK);

        assertThat(second.hasKey()).isTrue();
        assertThat(second.getPublicKey()).isEqualTo(publicKey);
        assertThat(second.verifyPdf(signed).isSigned()).isTrue();
    }

    @Test
    void exportedKeyVerifiesInAnotherEngine() throws Exception {
        PdfSealEngine signer = memoryEngine();
        String publicKey = signer.generateKeypair();
        byte[] signed = signer.signPdf(new SignRequest(TestPdfs.simple(1), "Alice", null)).signedPdf();

        PdfSealEngine other = memoryEngine();
        assertThat(other.importKey(signer.exportKey(), publicKey)).isEqualTo(publicKey);

        assertThat(other.verifyPdf(signed).isSigned()).isTrue();
    }

    @Test
    void enginesDoNotShareKeys() throws Exception {
        PdfSealEngine alice = memoryEngine();
        PdfSealEngine bob = memoryEngine();
        alice.generateKeypair();
        bob.generateKeypair();
        byte[] signed = alice.signPdf(new SignRequest(TestPdfs.simple(1), "Alice", null)).signedPdf();

        assertThat(bob.verify(signed).getStatus()).isEqualTo(VerificationStatus.KEY_MISMATCH);
        assertThat(bob.verifyPdf(signed).message()).isEqualTo("signed with a different key");
    }

    @Test
    void failedImportKeepsTheCurrentKey() throws Exception {
        PemKeyFileStore store = new PemKeyFileStore(tempDir);
        PdfSealEngine engine = PdfSealEngine.open(new SealOptions(), store, CLOCK);
        String publicKey = engine.generateKeypair();
        String storedPrivate = Files.readString(tempDir.resolve(PemKeyFileStore.PRIVATE_KEY_FILE));

        assertThatThrownBy(() -> engine.importKey("garbage", publicKey)).isInstanceOf(MalformedKeyException.class);

        assertThat(engine.getPublicKey()).isEqualTo(publicKey);
        assertThat(Files.readString(tempDir.resolve(PemKeyFileStore.PRIVATE_KEY_FILE))).isEqualTo(storedPrivate);
    }

    @Test
    void failedSaveDoesNotInstallTheKey() throws Exception {
        KeyPersistence failing = new KeyPersistence() {
            @Override
            public Optional<StoredKeyPair> load() {
                return Optional.empty();
            }

            @Override
            public void store(String privateKeyPem, String publicKeyPem) throws IOException {
                throw new IOException("disk full");
            }
        };
        PdfSealEngine engine = PdfSealEngine.open(new SealOptions(), failing, CLOCK);

        assertThatThrownBy(engine::generateKeypair)
                .isInstanceOf(PdfSealException.class)
                .hasMessageContaining("disk full");
        assertThat(engine.hasKey()).isFalse();
    }

    @Test
    void damagedKeyFilesCanBeReplaced() throws Exception {
        Files.writeString(tempDir.resolve(PemKeyFileStore.PRIVATE_KEY_FILE), "not a key");
        Files.writeString(tempDir.resolve(PemKeyFileStore.PUBLIC_KEY_FILE), "not a key either");
        PemKeyFileStore store = new PemKeyFileStore(tempDir);

        PdfSealEngine engine = PdfSealEngine.open(new SealOptions(), store, CLOCK);

        assertThat(engine.hasKey()).isFalse();
        assertThatThrownBy(() -> engine.signPdf(new SignRequest(TestPdfs.simple(1), "Alice", null)))
                .isInstanceOf(NoKeyLoadedException.class);

        String publicKey = engine.generateKeypair();

        assertThat(Files.readString(tempDir.resolve(PemKeyFileStore.PUBLIC_KEY_FILE))).isEqualTo(publicKey);
        assertThat(PdfSealEngine.open(new SealOptions(), store, CLOCK).getPublicKey()).isEqualTo(publicKey);
    }

    @Test
    void rejectsBadRequestsAndOptions() throws Exception {
        PdfSealEngine engine = memoryEngine();
        engine.generateKeypair();

        assertThatThrownBy(() -> engine.signPdf(null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.signPdf(new SignRequest(TestPdfs.simple(1), "", null)))
                .isInstanceOf(InvalidInputException.class);

        SealOptions options = new SealOptions();
        options.setDigestAlgorithm("MD5");
        assertThatThrownBy(() -> PdfSealEngine.open(options, KeyPersistence.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void optionsChooseTheAlgorithms() throws Exception {
        SealOptions options = new SealOptions();
        options.setDigestAlgorithm("SHA-384");
        options.setSignatureAlgorithm("RSA-PKCS1-SHA256");
        options.setWatermarkAllPages(true);
        PdfSealEngine engine = PdfSealEngine.open(options, KeyPersistence.NONE, CLOCK);
        engine.generateKeypair();

        byte[] signed = engine.signPdf(new SignRequest(TestPdfs.simple(2), "Alice", null)).signedPdf();

        assertThat(engine.verify(signed).getRecord().orElseThrow().getDigestAlgorithm()).isEqualTo("SHA-384");
        assertThat(TestPdfs.extractText(signed, 2)).contains("Digitally signed by Alice");
        // a default-configured engine with the same key still reads the record's algorithms
        PdfSealEngine reader = memoryEngine();
        reader.importKey(engine.exportKey(), engine.getPublicKey());
        assertThat(reader.verifyPdf(signed).isSigned()).isTrue();
    }
}
