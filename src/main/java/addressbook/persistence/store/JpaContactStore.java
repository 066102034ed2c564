package addressbook.persistence.store;

import addressbook.persistence.entity.ContactEntity;
import addressbook.persistence.repository.ContactRepository;
import addressbook.security.User;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA-backed {@link ContactStore}.
 *
 * <p>Simple lookups go through {@link ContactRepository}; the filtered listing is built with
 * the Criteria API and the birthday search uses JPQL over the month and day of the stored
 * date.
 */
@Component
public class JpaContactStore implements ContactStore {

    private static final String BIRTHDAY_QUERY = """
            SELECT c FROM ContactEntity c
            WHERE c.user = :owner
              AND ((EXTRACT(MONTH FROM c.birthday) * 100 + EXTRACT(DAY FROM c.birthday)) BETWEEN :firstFrom AND :firstTo
                OR (EXTRACT(MONTH FROM c.birthday) * 100 + EXTRACT(DAY FROM c.birthday)) BETWEEN :secondFrom AND :secondTo)
            ORDER BY c.id
            """;

    private final ContactRepository repository;

    @PersistenceContext
    private EntityManager entityManager;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores repository reference")
    public JpaContactStore(final ContactRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContactEntity> findAll(
            final User owner, final ContactFilter filter, final int skip, final int limit) {
        requireOwner(owner);
        if (limit <= 0) {
            return List.of();
        }
        final ContactFilter criteria = filter != null ? filter : ContactFilter.NONE;
        final CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        final CriteriaQuery<ContactEntity> query = cb.createQuery(ContactEntity.class);
        final Root<ContactEntity> contact = query.from(ContactEntity.class);

        final List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(contact.get("user"), owner));
        addContains(cb, predicates, contact, "firstName", criteria.firstName());
        addContains(cb, predicates, contact, "lastName", criteria.lastName());
        addContains(cb, predicates, contact, "email", criteria.email());

        query.select(contact)
                .where(predicates.toArray(new Predicate[0]))
                .orderBy(cb.asc(contact.get("id")));
        return entityManager.createQuery(query)
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContactEntity> findById(final Long id, final User owner) {
        requireOwner(owner);
        if (id == null) {
            return Optional.empty();
        }
        return repository.findByIdAndUser(id, owner);
    }

    @Override
    @Transactional
    public ContactEntity save(final ContactEntity contact, final User owner) {
        requireOwner(owner);
        if (contact == null) {
            throw new IllegalArgumentException("contact must not be null");
        }
        if (contact.getUser() == null || !owner.getId().equals(contact.getUser().getId())) {
            throw new IllegalArgumentException("contact does not belong to owner");
        }
        return repository.saveAndFlush(contact);
    }

    @Override
    @Transactional
    public void delete(final ContactEntity contact, final User owner) {
        requireOwner(owner);
        if (contact == null) {
            throw new IllegalArgumentException("contact must not be null");
        }
        if (!owner.getId().equals(contact.getUser().getId())) {
            throw new IllegalArgumentException("contact does not belong to owner");
        }
        repository.delete(contact);
        repository.flush();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContactEntity> findBirthdaysWithin(
            final User owner, final BirthdayWindow window, final int skip, final int limit) {
        requireOwner(owner);
        if (window == null) {
            throw new IllegalArgumentException("window must not be null");
        }
        if (limit <= 0) {
            return List.of();
        }
        return entityManager.createQuery(BIRTHDAY_QUERY, ContactEntity.class)
                .setParameter("owner", owner)
                .setParameter("firstFrom", window.firstFrom())
                .setParameter("firstTo", window.firstTo())
                .setParameter("secondFrom", window.secondFrom())
                .setParameter("secondTo", window.secondTo())
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }

    private static void addContains(
            final CriteriaBuilder cb,
            final List<Predicate> predicates,
            final Root<ContactEntity> contact,
            final String attribute,
            final String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        final String pattern = "%" + escapeLike(value.trim().toLowerCase(Locale.ROOT)) + "%";
        predicates.add(cb.like(cb.lower(contact.get(attribute)), pattern, '\\'));
    }

    private static String escapeLike(final String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static void requireOwner(final User owner) {
        if (owner == null) {
            throw new IllegalArgumentException("user must not be null");
        }
    }
}
