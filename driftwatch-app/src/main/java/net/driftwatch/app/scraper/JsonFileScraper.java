package net.driftwatch.app.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.driftwatch.core.error.ScrapeException;
import net.driftwatch.core.model.CredentialsRef;
import net.driftwatch.core.model.Snapshot;
import net.driftwatch.core.spi.Scraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 디렉터리에 떨어진 스냅샷 파일을 읽는 Scraper.
 * 경로: {@code <root>/<userId>/<kind>.json}, 형식: {@code {"jobs":[{...JobRecord...}]}}
 */
public class JsonFileScraper implements Scraper {
    private static final Logger log = LoggerFactory.getLogger(JsonFileScraper.class);

    private final Path root;
    private final ObjectMapper mapper;

    public JsonFileScraper(Path root, ObjectMapper mapper) {
        this.root = root.toAbsolutePath().normalize();
        this.mapper = mapper;
    }

    @Override
    public Snapshot fetch(CredentialsRef credentials) throws ScrapeException {
        Path file = resolve(credentials);
        if (!Files.isRegularFile(file)) {
            throw new ScrapeException("snapshot not found: " + root.relativize(file));
        }
        try {
            Snapshot snapshot = mapper.readValue(file.toFile(), Snapshot.class);
            log.debug("Read {} job(s) from {}", snapshot.size(), file);
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new ScrapeException("malformed snapshot " + root.relativize(file) + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ScrapeException("cannot read snapshot " + root.relativize(file), e);
        }
    }

    Path resolve(CredentialsRef credentials) throws ScrapeException {
        Path file = root.resolve(credentials.userId()).resolve(credentials.kind() + ".json").normalize();
        // userId/kind에 ".." 등이 섞여 root 밖으로 나가는 경우 차단
        if (!file.startsWith(root)) {
            throw new ScrapeException("snapshot path escapes root: " + credentials.userId() + "/" + credentials.kind());
        }
        return file;
    }
}
