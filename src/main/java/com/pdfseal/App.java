package com.pdfseal;

import com.pdfseal.crypto.PemKeyFileStore;
import com.pdfseal.error.PdfSealException;
import com.pdfseal.pdf.Canonicalizer;
import com.pdfseal.pdf.SealInspection;
import com.pdfseal.pdf.WatermarkRenderer;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_VALID = 2;

    public static void main(String[] args) {
        int exit = commandLine().execute(args);
        System.exit(exit);
    }

    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new Root());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof PdfSealException || ex instanceof IOException || ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Error: " + ex.getMessage());
                return EXIT_ERROR;
            }
            throw ex;
        });
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine source = ex.getCommandLine();
            source.getErr().println(ex.getMessage());
            source.usage(source.getErr());
            return EXIT_ERROR;
        });
        return cmd;
    }

    @CommandLine.Command(name = "pdf-seal", mixinStandardHelpOptions = true,
            description = "Seal PDF documents with an RSA signature and verify sealed documents",
            subcommands = {
                    KeyGen.class,
                    ImportKey.class,
                    ExportKey.class,
                    ShowPublicKey.class,
                    Sign.class,
                    Verify.class,
                    Inspect.class
            })
    static class Root implements Runnable {

        @CommandLine.Option(names = "--key-dir", scope = CommandLine.ScopeType.INHERIT,
                description = "Directory holding private.pem and public.pem (default: $PDFSEAL_HOME or ~/.pdfseal)")
        private Path keyDir;

        @CommandLine.Option(names = "--key-size", defaultValue = "2048", scope = CommandLine.ScopeType.INHERIT,
                description = "RSA modulus size for keygen: 2048, 3072 or 4096")
        private int keySize;

        @CommandLine.Option(names = "--digest", defaultValue = "SHA-256", scope = CommandLine.ScopeType.INHERIT,
                description = "Digest for new seals: SHA-256, SHA-384 or SHA-512")
        private String digest;

        @CommandLine.Option(names = "--signature-algorithm", defaultValue = "RSASSA-PSS-SHA256",
                scope = CommandLine.ScopeType.INHERIT,
                description = "Signature scheme for new seals: RSASSA-PSS-SHA256 or RSA-PKCS1-SHA256")
        private String signatureAlgorithm;

        @CommandLine.Option(names = "--watermark-font", scope = CommandLine.ScopeType.INHERIT,
                description = "Optional TrueType/OpenType font for the watermark (default Helvetica)")
        private Path watermarkFont;

        @CommandLine.Option(names = "--watermark-font-size", defaultValue = "8", scope = CommandLine.ScopeType.INHERIT,
                description = "Watermark font size in points")
        private float watermarkFontSize;

        @CommandLine.Option(names = "--watermark-all-pages", scope = CommandLine.ScopeType.INHERIT,
                description = "Stamp the watermark on every page instead of only the first")
        private boolean watermarkAllPages;

        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }

        Path resolveKeyDir() {
            if (keyDir != null) {
                return keyDir.toAbsolutePath();
            }
            String home = System.getenv("PDFSEAL_HOME");
            if (home != null && !home.isBlank()) {
                return Paths.get(home).toAbsolutePath();
            }
            return Paths.get(System.getProperty("user.home"), ".pdfseal");
        }

        SealOptions options() {
            SealOptions options = new SealOptions();
            options.setKeySize(keySize);
            options.setDigestAlgorithm(digest);
            options.setSignatureAlgorithm(signatureAlgorithm);
            options.setWatermarkFontPath(watermarkFont);
            options.setWatermarkFontSize(watermarkFontSize);
            options.setWatermarkAllPages(watermarkAllPages);
            return options;
        }

        PdfSealEngine openEngine() throws PdfSealException {
            return PdfSealEngine.open(options(), new PemKeyFileStore(resolveKeyDir()));
        }
    }

    @CommandLine.Command(name = "keygen", description = "Generate a new signing keypair, replacing the stored one")
    static class KeyGen implements Callable<Integer> {
        @CommandLine.ParentCommand
        private Root root;

        @Override
        public Integer call() throws Exception {
            String publicKey = root.openEngine().generateKeypair();
            System.out.println("Keypair written to " + root.resolveKeyDir());
            System.out.print(publicKey);
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "import-key", description = "Import a PEM keypair, replacing the stored one")
    static class ImportKey implements Callable<Integer> {
        @CommandLine.ParentCommand
        private Root root;

        @CommandLine.Option(names = "--private", required = true, description = "PKCS#8 or PKCS#1 private key PEM file")
        private Path privateKey;

        @CommandLine.Option(names = "--public", required = true, description = "SubjectPublicKeyInfo PEM file")
        private Path publicKey;

        @Override
        public Integer call() throws Exception {
            String privatePem = Files.readString(privateKey, StandardCharsets.US_ASCII);
            String publicPem = Files.readString(publicKey, StandardCharsets.US_ASCII);
            root.openEngine().importKey(privatePem, publicPem);
            System.out.println("Keypair imported into " + root.resolveKeyDir());
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "export-key", description = "Print or write the private key as PKCS#8 PEM")
    static class ExportKey implements Callable<Integer> {
        @CommandLine.ParentCommand
        private Root root;

        @CommandLine.Option(names = "--out", description = "Destination file (default: standard output)")
        private Path output;

        @Override
        public Integer call() throws Exception {
            String pem = root.openEngine().exportKey();
            if (output == null) {
                System.out.print(pem);
            } else {
                Files.writeString(output, pem, StandardCharsets.US_ASCII);
                System.out.println("Private key written to " + output.toAbsolutePath());
            }
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "public-key", description = "Print the public key as PEM")
    static class ShowPublicKey implements Callable<Integer> {
        @CommandLine.ParentCommand
        private Root root;

        @Override
        public Integer call() throws Exception {
            System.out.print(root.openEngine().getPublicKey());
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "sign", description = "Seal a PDF and write the signed copy")
    static class Sign implements Callable<Integer> {
        @CommandLine.ParentCommand
        private Root root;

        @CommandLine.Option(names = "--src", required = true, description = "Source PDF")
        private Path source;

        @CommandLine.Option(names = "--dest", required = true, description = "Destination PDF")
        private Path destination;

        @CommandLine.Option(names = "--name", required = true, description = "Signer name shown in the watermark")
        private String name;

        @CommandLine.Option(names = "--extra", description = "Optional extra text, one watermark line per line")
        private String extra;

        @Override
        public Integer call() throws Exception {
            Path srcFile = source.toAbsolutePath();
            if (!Files.exists(srcFile)) {
                System.err.println("Source PDF does not exist: " + srcFile);
                return EXIT_ERROR;
            }
            SignResponse response = root.openEngine()
                    .signPdf(new SignRequest(Files.readAllBytes(srcFile), name, extra));
            Files.write(destination, response.signedPdf());
            SignatureInfo info = response.signatureInfo();
            System.out.println("Signed by " + info.signerName() + " at " + info.timestamp()
                    + " -> " + destination.toAbsolutePath());
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "verify", description = "Verify a sealed PDF against the stored public key")
    static class Verify implements Callable<Integer> {
        @CommandLine.ParentCommand
        private Root root;

        @CommandLine.Option(names = "--pdf", required = true, description = "PDF to verify")
        private Path pdf;

        @Override
        public Integer call() throws Exception {
            VerifyResponse response = root.openEngine().verifyPdf(Files.readAllBytes(pdf));
            System.out.println("Result: " + response.message());
            response.info().ifPresent(info -> {
                System.out.println("Signer: " + info.signerName());
                System.out.println("Time:   " + info.timestamp());
                if (!info.extra().isEmpty()) {
                    System.out.println("Extra:  " + info.extra());
                }
                System.out.println("Signature: " + info.signature());
            });
            return response.isSigned() ? EXIT_OK : EXIT_NOT_VALID;
        }
    }

    @CommandLine.Command(name = "inspect", description = "Show page count, seal presence and first-page watermark text")
    static class Inspect implements Callable<Integer> {

        @CommandLine.Option(names = "--pdf", required = true, description = "PDF to inspect")
        private Path pdf;

        @Override
        public Integer call() throws Exception {
            byte[] bytes = Files.readAllBytes(pdf);
            SealInspection inspection = new Canonicalizer().inspect(bytes);
            System.out.printf("File: %s (%d bytes)%n", pdf.toAbsolutePath(), bytes.length);
            System.out.printf("Seal record: %s%n", describe(inspection));
            System.out.printf("Canonical range: %s%n", inspection.range());

            try (PDDocument doc = Loader.loadPDF(bytes)) {
                System.out.printf("Pages: %d%n", doc.getNumberOfPages());
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setStartPage(1);
                stripper.setEndPage(1);
                String text = stripper.getText(doc);
                int at = text.indexOf(WatermarkRenderer.HEADLINE_PREFIX.trim());
                if (at < 0) {
                    System.out.println("Watermark: none");
                } else {
                    String line = text.substring(at).lines().findFirst().orElse("");
                    System.out.println("Watermark: " + line.trim());
                }
            }
            return EXIT_OK;
        }

        private static String describe(SealInspection inspection) {
            if (!inspection.hasRecord()) {
                return "none";
            }
            if (inspection.isCorrupt()) {
                return "corrupt (" + inspection.corruption().orElse("unknown") + ")";
            }
            String signer = inspection.record().map(r -> r.getSignerName() + " at " + r.getTimestamp()).orElse("");
            return inspection.isModifiedAfterSealing()
                    ? signer + ", followed by " + inspection.revisionsAfterSeal() + " revision(s) and "
                    + inspection.bytesAfterFinalEof() + " stray byte(s)"
                    : signer;
        }
    }
}
