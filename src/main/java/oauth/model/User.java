package oauth.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;

/**
 * Profile of an end-user of the course-review application. The collection is owned by the application,
 * the authorization server only reads it.
 */
@NoArgsConstructor
@Getter
@ToString(of = {"id", "username"})
@Document(collection = "users")
public class User implements Serializable {

    @Id
    private String id;
    private String email;
    private String username;
    private String displayName;
    private Integer graduationYear;
    private String major;
    private String bio;
    private String avatarUrl;

    public User(String id, String email, String username, String displayName, Integer graduationYear,
                String major, String bio, String avatarUrl) {
        this.id = id;
        this.email = email;
        this.username = username;
        this.displayName = displayName;
        this.graduationYear = graduationYear;
        this.major = major;
        this.bio = bio;
        this.avatarUrl = avatarUrl;
    }
}
