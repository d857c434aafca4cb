package org.dxworks.pageframe.validator;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpAssetProbeTest {

    @Test
    void malformedUrl_isUnreachableWithoutARequest() {
        AssetProbeResult result = new HttpAssetProbe().probe("https://cdn example.com/a b.png", Duration.ofSeconds(1));

        assertNull(result.statusCode);
        assertFalse(result.probeFailed);
        assertFalse(result.isReachable());
        assertTrue(result.error.startsWith("Invalid URL: "));
    }
}
