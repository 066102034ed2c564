package addressbook.persistence;

import addressbook.api.exception.DuplicateResourceException;
import addressbook.persistence.entity.ContactEntity;
import addressbook.security.User;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.interceptor.TransactionAspectSupport;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Single error boundary around mutating repository calls.
 *
 * <p>A {@link DataIntegrityViolationException} raised by the wrapped call marks the current
 * transaction rollback-only and is rethrown as a {@link DuplicateResourceException} whose
 * message depends on which named constraint was violated. Database text never reaches the
 * caller.
 */
@Component
public class IntegrityViolationTranslator {

    public static final String CONTACT_EMAIL_MESSAGE = "The contact with this email already exists.";
    public static final String USER_EMAIL_MESSAGE = "User with this email already exists";
    public static final String USER_USERNAME_MESSAGE = "User with this username already exists";
    public static final String GENERIC_MESSAGE = "The integrity error occurred.";

    private static final Logger LOG = LoggerFactory.getLogger(IntegrityViolationTranslator.class);

    private static final Map<String, String> MESSAGES_BY_CONSTRAINT = new LinkedHashMap<>();

    static {
        MESSAGES_BY_CONSTRAINT.put(ContactEntity.OWNER_EMAIL_CONSTRAINT, CONTACT_EMAIL_MESSAGE);
        MESSAGES_BY_CONSTRAINT.put(User.EMAIL_CONSTRAINT, USER_EMAIL_MESSAGE);
        MESSAGES_BY_CONSTRAINT.put(User.USERNAME_CONSTRAINT, USER_USERNAME_MESSAGE);
    }

    /**
     * Runs a write and translates integrity violations.
     *
     * @param write the mutating call, which should flush
     * @param <T>   result type
     * @return whatever the write returns
     * @throws DuplicateResourceException if the write violated a constraint
     */
    public <T> T execute(final Supplier<T> write) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException ex) {
            markRollbackOnly();
            final String message = messageFor(ex);
            LOG.debug("Integrity violation translated to conflict: {}", message);
            throw new DuplicateResourceException(message, ex);
        }
    }

    /**
     * Void variant of {@link #execute(Supplier)}.
     */
    public void run(final Runnable write) {
        execute(() -> {
            write.run();
            return null;
        });
    }

    static String messageFor(final DataIntegrityViolationException ex) {
        final String constraint = constraintName(ex);
        if (constraint != null) {
            final String lower = constraint.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> entry : MESSAGES_BY_CONSTRAINT.entrySet()) {
                if (lower.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return GENERIC_MESSAGE;
    }

    /**
     * Returns the violated constraint's name when Hibernate extracted it, else the most
     * specific driver message (which for PostgreSQL and H2 quotes the constraint name).
     */
    private static String constraintName(final DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        while (cause != null) {
            if (cause instanceof ConstraintViolationException cve && cve.getConstraintName() != null) {
                return cve.getConstraintName();
            }
            cause = cause.getCause();
        }
        return ex.getMostSpecificCause().getMessage();
    }

    private static void markRollbackOnly() {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
        }
    }
}
