package oauth.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;

/**
 * End-user behind a valid session token of the identity provider.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class AuthenticatedUser implements Serializable {

    private final String id;
    private final String email;

}
