package it.unimib.datai.frontdoor.examples.echoapi;

import it.unimib.datai.frontdoor.common.runtime.ServiceSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Stand-in for the expensive services a real API would prepare on its first request.
 * Checks that the upload directory is writable and records when it became ready.
 */
public class EchoServices implements ServiceSetup {
    private static final Logger log = LoggerFactory.getLogger(EchoServices.class);

    private final Path uploadDir;
    private volatile Instant readySince;

    public EchoServices(Path uploadDir) {
        this.uploadDir = uploadDir;
    }

    @Override
    public void initialize() throws IOException {
        Path writeCheck = Files.createTempFile(uploadDir, "write-check-", ".tmp");
        Files.delete(writeCheck);
        readySince = Instant.now();
        log.info("Echo services ready, uploads go to {}", uploadDir);
    }

    public boolean isReady() {
        return readySince != null;
    }

    public Instant readySince() {
        return readySince;
    }

    public Path uploadDir() {
        return uploadDir;
    }
}
