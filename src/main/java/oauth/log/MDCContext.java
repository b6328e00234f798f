package oauth.log;

import oauth.model.AuthenticatedUser;
import org.slf4j.MDC;
import org.slf4j.spi.MDCAdapter;
import org.springframework.util.Assert;

public class MDCContext {

    private MDCContext() {
    }

    public static void mdcContext(String... args) {
        mdcContext(null, args);
    }

    public static void mdcContext(AuthenticatedUser user, String... args) {
        Assert.isTrue(args.length % 2 == 0, "contextMap requires an even number of arguments");
        MDCAdapter mdcAdapter = MDC.getMDCAdapter();
        for (int i = 0; i < args.length - 1; i += 2) {
            if (args[i + 1] != null) {
                mdcAdapter.put(args[i], args[i + 1]);
            }
        }
        if (MDC.get("user_id") == null && user != null) {
            mdcAdapter.put("user_id", user.getId());
        }
    }

}
