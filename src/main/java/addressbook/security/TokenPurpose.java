package addressbook.security;

/**
 * Enumerates what a signed token may be used for.
 *
 * <p>Both kinds share one signing key, so the {@code token_use} claim is what stops an
 * email-confirmation link from being replayed as a bearer credential (and vice versa).
 */
public enum TokenPurpose {
    ACCESS("access"),
    EMAIL_CONFIRMATION("email_confirmation");

    private final String claimValue;

    TokenPurpose(final String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    /**
     * Resolves a token purpose from the claim value.
     *
     * @param claim the claim value
     * @return the matching TokenPurpose, or null if unknown
     */
    public static TokenPurpose fromClaim(final String claim) {
        if (claim == null) {
            return null;
        }
        for (TokenPurpose purpose : values()) {
            if (purpose.claimValue.equals(claim)) {
                return purpose;
            }
        }
        return null;
    }
}
