package net.driftwatch.core.spi;

import net.driftwatch.core.error.ScrapeException;
import net.driftwatch.core.model.CredentialsRef;
import net.driftwatch.core.model.Snapshot;

/** 외부 수집기. 재시도해도 안전해야 한다. */
public interface Scraper {
    Snapshot fetch(CredentialsRef credentials) throws ScrapeException;
}
