package addressbook.service;

import addressbook.config.AsyncConfig;
import addressbook.security.JwtService;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Sends email-confirmation messages.
 *
 * <p>Runs on the {@value AsyncConfig#MAIL_EXECUTOR} pool. The caller never waits for the
 * SMTP exchange and never sees its failures; they are logged and dropped.
 */
@Service
public class EmailService {

    static final String CONFIRMATION_PATH = "api/auth/confirmed_email/";
    static final String SUBJECT = "Confirm your email";

    private static final Logger LOG = LoggerFactory.getLogger(EmailService.class);

    private final JavaMailSender mailSender;
    private final JwtService jwtService;
    private final String fromAddress;

    public EmailService(
            final JavaMailSender mailSender,
            final JwtService jwtService,
            @Value("${app.mail.from:noreply@address-book.local}") final String fromAddress) {
        this.mailSender = mailSender;
        this.jwtService = jwtService;
        this.fromAddress = fromAddress;
    }

    /**
     * Issues a confirmation token for {@code email} and mails the confirmation link.
     *
     * @param email    recipient and token subject
     * @param username greeting name
     * @param baseUrl  public base URL of this service ending with {@code /}
     */
    @Async(AsyncConfig.MAIL_EXECUTOR)
    public void sendConfirmationEmail(final String email, final String username, final String baseUrl) {
        try {
            final String token = jwtService.issueConfirmationToken(email);
            final String link = confirmationLink(baseUrl, token);
            final MimeMessage message = mailSender.createMimeMessage();
            final MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
            helper.setFrom(fromAddress);
            helper.setTo(email);
            helper.setSubject(SUBJECT);
            helper.setText(body(username, link), true);
            mailSender.send(message);
            LOG.info("Confirmation email sent to user '{}'", username);
        } catch (MailException | MessagingException e) {
            LOG.warn("Failed to send confirmation email to user '{}': {}", username, e.getMessage());
        }
    }

    static String confirmationLink(final String baseUrl, final String token) {
        final String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return base + CONFIRMATION_PATH + token;
    }

    private static String body(final String username, final String link) {
        final String safeName = HtmlUtils.htmlEscape(username);
        final String safeLink = HtmlUtils.htmlEscape(link);
        return "<p>Hello " + safeName + ",</p>"
                + "<p>Please confirm your email address by following this link:</p>"
                + "<p><a href=\"" + safeLink + "\">" + safeLink + "</a></p>"
                + "<p>The link is valid for 7 days.</p>";
    }
}
