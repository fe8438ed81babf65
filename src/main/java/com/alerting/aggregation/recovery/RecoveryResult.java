package com.alerting.aggregation.recovery;

/**
 * Counters of one batch recovery pass.
 *
 * @param processed events handed in
 * @param linked new alert-event links written
 * @param skippedDuplicates candidate links that already existed
 * @param skippedMissingExternalId events dropped for lacking an external id
 * @param recovered alerts moved to AUTO_RECOVERY by the new links
 */
public record RecoveryResult(int processed, int linked, int skippedDuplicates, int skippedMissingExternalId,
                             int recovered) {

    public static RecoveryResult empty(int processed, int skippedMissingExternalId) {
        return new RecoveryResult(processed, 0, 0, skippedMissingExternalId, 0);
    }
}
