package oauth.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "admin")
public class AdminUsers {

    private List<String> emails = new ArrayList<>();

    public boolean isAdmin(String email) {
        return email != null && emails.stream().anyMatch(adminEmail -> adminEmail.equalsIgnoreCase(email));
    }
}
