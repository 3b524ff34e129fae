package warden.core.model.auth;

/**
 * What a single-use code unlocks. Each user holds at most one live code per purpose.
 */
public enum OneTimeCodePurpose {
    EMAIL_VERIFICATION,
    PASSWORD_RESET
}
