package oauth.endpoints;

/**
 * How a protocol error reaches the user agent.
 */
public enum Disposition {

    //the redirect URI is not trusted (yet), so the error stays on our own page
    ERROR_PAGE,
    CLIENT_REDIRECT,
    JSON

}
