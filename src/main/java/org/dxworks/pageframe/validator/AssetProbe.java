package org.dxworks.pageframe.validator;

import java.time.Duration;

/**
 * Checks whether an asset URL can be fetched. Implementations report
 * failures in the result instead of throwing.
 */
public interface AssetProbe {

    AssetProbeResult probe(String url, Duration timeout);
}
