package org.dxworks.pageframe.validator;

public class AssetProbeResult {
    public final Integer statusCode;
    public final String error;
    public final boolean probeFailed; // timeout or client error, says nothing about the asset

    private AssetProbeResult(Integer statusCode, String error, boolean probeFailed) {
        this.statusCode = statusCode;
        this.error = error;
        this.probeFailed = probeFailed;
    }

    public static AssetProbeResult status(int statusCode) {
        return new AssetProbeResult(statusCode, null, false);
    }

    /** The host could not be reached or the URL is not fetchable. */
    public static AssetProbeResult unreachable(String error) {
        return new AssetProbeResult(null, error, false);
    }

    public static AssetProbeResult timedOut(String error) {
        return new AssetProbeResult(null, error, true);
    }

    public static AssetProbeResult failed(String error) {
        return new AssetProbeResult(null, error, true);
    }

    public boolean isReachable() {
        return statusCode != null && statusCode >= 200 && statusCode < 400;
    }
}
