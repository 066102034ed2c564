package addressbook.persistence.store;

import addressbook.persistence.entity.ContactEntity;
import addressbook.security.User;
import java.util.List;
import java.util.Optional;

/**
 * Owner-scoped persistence contract for contacts.
 *
 * <p>Every method takes the owning {@link User}; rows belonging to anyone else are never
 * returned, changed or removed. Implementations reject a null owner with
 * {@link IllegalArgumentException}.
 */
public interface ContactStore {

    /**
     * @param owner  owning user
     * @param filter substring criteria, never null
     * @param skip   rows to skip, ordered by id
     * @param limit  maximum rows to return
     * @return matching contacts
     */
    List<ContactEntity> findAll(User owner, ContactFilter filter, int skip, int limit);

    Optional<ContactEntity> findById(Long id, User owner);

    /**
     * Inserts or updates a contact and flushes so that constraint violations surface here.
     *
     * @param contact contact whose owner is {@code owner}
     * @param owner   owning user
     * @return the managed contact
     */
    ContactEntity save(ContactEntity contact, User owner);

    void delete(ContactEntity contact, User owner);

    /**
     * @param owner  owning user
     * @param window calendar range to match, year ignored
     * @param skip   rows to skip, ordered by id
     * @param limit  maximum rows to return
     * @return contacts whose birthday falls inside the window
     */
    List<ContactEntity> findBirthdaysWithin(User owner, BirthdayWindow window, int skip, int limit);
}
