package addressbook.persistence.repository;

import addressbook.persistence.entity.ContactEntity;
import addressbook.security.User;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data repository for {@link ContactEntity}.
 *
 * <p>Lookups always include the owner so that another user's row is indistinguishable from
 * a missing one.
 */
@Repository
public interface ContactRepository extends JpaRepository<ContactEntity, Long> {

    Optional<ContactEntity> findByIdAndUser(Long id, User user);
}
