package addressbook.service;

import addressbook.api.dto.ContactRequest;
import addressbook.api.dto.ContactUpdateRequest;
import addressbook.persistence.IntegrityViolationTranslator;
import addressbook.persistence.entity.ContactEntity;
import addressbook.persistence.store.BirthdayWindow;
import addressbook.persistence.store.ContactFilter;
import addressbook.persistence.store.ContactStore;
import addressbook.security.User;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner-scoped contact operations.
 *
 * <p>The authenticated {@link User} is passed explicitly to every method and becomes part of
 * every query, so another user's contact behaves exactly like a missing one. Writes go through
 * {@link IntegrityViolationTranslator}; a second contact with the same email in one address
 * book is reported as a conflict.
 */
@Service
public class ContactService {

    /** Default page size for {@link #list}. */
    public static final int DEFAULT_LIST_LIMIT = 100;

    /** Default page size for {@link #upcomingBirthdays}. */
    public static final int DEFAULT_BIRTHDAY_LIMIT = 10;

    /** Largest page size a caller may request. */
    public static final int MAX_LIMIT = 1000;

    private static final Logger LOG = LoggerFactory.getLogger(ContactService.class);

    private final ContactStore store;
    private final IntegrityViolationTranslator integrityViolationTranslator;
    private final Clock clock;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores collaborator references")
    public ContactService(
            final ContactStore store,
            final IntegrityViolationTranslator integrityViolationTranslator,
            final Clock clock) {
        this.store = store;
        this.integrityViolationTranslator = integrityViolationTranslator;
        this.clock = clock;
    }

    /**
     * Lists the owner's contacts ordered by id.
     *
     * @param owner  authenticated user
     * @param skip   rows to skip (negative is treated as 0)
     * @param limit  page size, clamped to [0, {@value #MAX_LIMIT}]
     * @param filter substring criteria; null matches everything
     * @return one page of contacts
     */
    @Transactional(readOnly = true)
    public List<ContactEntity> list(final User owner, final int skip, final int limit, final ContactFilter filter) {
        return store.findAll(owner, filter, normalizeSkip(skip), normalizeLimit(limit));
    }

    @Transactional(readOnly = true)
    public Optional<ContactEntity> get(final User owner, final Long id) {
        return store.findById(id, owner);
    }

    /**
     * @throws addressbook.api.exception.DuplicateResourceException if the owner already has a
     *     contact with this email
     */
    @Transactional
    public ContactEntity create(final User owner, final ContactRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("contact request must not be null");
        }
        final ContactEntity contact = new ContactEntity(
                request.firstName(),
                request.lastName(),
                request.email(),
                request.phoneNumber(),
                request.birthday(),
                request.extraInfo(),
                owner);
        final ContactEntity saved = integrityViolationTranslator.execute(() -> store.save(contact, owner));
        LOG.debug("Created contact id={} for user id={}", saved.getId(), owner.getId());
        return saved;
    }

    /**
     * Applies the non-null fields of {@code request} to the owner's contact.
     *
     * @return the updated contact, or empty if the owner has no contact with this id
     */
    @Transactional
    public Optional<ContactEntity> update(final User owner, final Long id, final ContactUpdateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("contact update must not be null");
        }
        final Optional<ContactEntity> found = store.findById(id, owner);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        final ContactEntity contact = found.get();
        if (request.firstName() != null) {
            contact.setFirstName(request.firstName());
        }
        if (request.lastName() != null) {
            contact.setLastName(request.lastName());
        }
        if (request.email() != null) {
            contact.setEmail(request.email());
        }
        if (request.phoneNumber() != null) {
            contact.setPhoneNumber(request.phoneNumber());
        }
        if (request.birthday() != null) {
            contact.setBirthday(request.birthday());
        }
        if (request.extraInfo() != null) {
            contact.setExtraInfo(request.extraInfo());
        }
        return Optional.of(integrityViolationTranslator.execute(() -> store.save(contact, owner)));
    }

    /**
     * @return the removed contact, or empty if the owner has no contact with this id
     */
    @Transactional
    public Optional<ContactEntity> remove(final User owner, final Long id) {
        final Optional<ContactEntity> found = store.findById(id, owner);
        found.ifPresent(contact -> integrityViolationTranslator.run(() -> store.delete(contact, owner)));
        return found;
    }

    /**
     * Lists the owner's contacts whose birthday, ignoring the year, falls between today and
     * seven days from today inclusive.
     */
    @Transactional(readOnly = true)
    public List<ContactEntity> upcomingBirthdays(final User owner, final int skip, final int limit) {
        final BirthdayWindow window = BirthdayWindow.startingOn(LocalDate.now(clock), BirthdayWindow.DEFAULT_DAYS_AHEAD);
        LOG.debug("Searching birthdays in {}", window);
        return store.findBirthdaysWithin(owner, window, normalizeSkip(skip), normalizeLimit(limit));
    }

    private static int normalizeSkip(final int skip) {
        return Math.max(0, skip);
    }

    private static int normalizeLimit(final int limit) {
        return Math.min(Math.max(0, limit), MAX_LIMIT);
    }
}
