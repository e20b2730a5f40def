package ai.chatbridge.translator.quota;

/**
 * Outcome of a quota check with the prospective totals it was judged on.
 */
public record QuotaDecision(boolean allowed, Reason reason, long dayTotal, long minuteTotal) {

    public enum Reason {
        NONE,
        DAILY_LIMIT,
        RATE_LIMIT
    }

    static QuotaDecision allow(long dayTotal, long minuteTotal) {
        return new QuotaDecision(true, Reason.NONE, dayTotal, minuteTotal);
    }

    static QuotaDecision reject(Reason reason, long dayTotal, long minuteTotal) {
        return new QuotaDecision(false, reason, dayTotal, minuteTotal);
    }
}
