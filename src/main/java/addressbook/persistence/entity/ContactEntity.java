package addressbook.persistence.entity;

import addressbook.security.User;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;
import java.util.Objects;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * JPA entity for a contact in one user's address book.
 *
 * <p>The pair (owner, email) is unique; the constraint is named so a violation can be told
 * apart from other integrity failures. The owner is fixed at creation and every query over
 * this table filters by it.
 */
@Entity
@Table(
        name = "contacts",
        uniqueConstraints = @UniqueConstraint(
                name = ContactEntity.OWNER_EMAIL_CONSTRAINT,
                columnNames = {"user_id", "email"}),
        indexes = {
                @Index(name = "ix_contacts_first_name", columnList = "first_name"),
                @Index(name = "ix_contacts_last_name", columnList = "last_name"),
                @Index(name = "ix_contacts_email", columnList = "email")
        })
public class ContactEntity {

    /** Unique constraint name on {@code contacts(user_id, email)}. */
    public static final String OWNER_EMAIL_CONSTRAINT = "uq_contacts_user_email";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Column(nullable = false)
    private String email;

    @Column(name = "phone_number", nullable = false, length = 15)
    private String phoneNumber;

    @Column(nullable = false)
    private LocalDate birthday;

    @Column(name = "extra_info")
    private String extraInfo;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_contacts_user"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    /**
     * Default constructor for JPA.
     */
    protected ContactEntity() {
    }

    /**
     * Creates a new contact owned by {@code user}.
     *
     * @throws IllegalArgumentException if the owner is null
     */
    @SuppressFBWarnings(
            value = {"CT_CONSTRUCTOR_THROW", "EI_EXPOSE_REP2"},
            justification = "Owner reference is a managed JPA association; validation in constructor is intentional")
    public ContactEntity(
            final String firstName,
            final String lastName,
            final String email,
            final String phoneNumber,
            final LocalDate birthday,
            final String extraInfo,
            final User user) {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.phoneNumber = phoneNumber;
        this.birthday = birthday;
        this.extraInfo = extraInfo;
        this.user = user;
    }

    public Long getId() {
        return id;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(final String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(final String lastName) {
        this.lastName = lastName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(final String email) {
        this.email = email;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(final String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public LocalDate getBirthday() {
        return birthday;
    }

    public void setBirthday(final LocalDate birthday) {
        this.birthday = birthday;
    }

    public String getExtraInfo() {
        return extraInfo;
    }

    public void setExtraInfo(final String extraInfo) {
        this.extraInfo = extraInfo;
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "JPA entity relationship requires returning the actual User object")
    public User getUser() {
        return user;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContactEntity other)) {
            return false;
        }
        return id != null && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
