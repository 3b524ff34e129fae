package warden.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for outbound email.
 */
public interface Notifier {

    /**
     * Send an email verification code.
     *
     * @param email   recipient
     * @param code    the verification code
     * @param context template variables (e.g. {@code first_name})
     * @return Uni completing when the message has been handed off
     */
    Uni<Void> sendVerificationEmail(String email, String code, Map<String, String> context);

    /**
     * Send a password reset token.
     *
     * @param email   recipient
     * @param code    the reset token
     * @param context template variables (e.g. {@code first_name})
     * @return Uni completing when the message has been handed off
     */
    Uni<Void> sendPasswordResetEmail(String email, String code, Map<String, String> context);
}
