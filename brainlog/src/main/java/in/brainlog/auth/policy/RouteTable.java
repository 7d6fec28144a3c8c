package in.brainlog.auth.policy;

import java.util.List;

/**
 * Ordered path-prefix rules. First match wins; unmatched paths are PROTECTED.
 *
 * Segment rules match the path itself and anything below it ("/admin" matches
 * "/admin" and "/admin/users" but not "/administrator"). Prefix rules match any
 * path starting with the prefix ("/favicon" matches "/favicon.ico").
 */
public final class RouteTable {

    public static final String AUTH_API_PREFIX = "/api/auth/";

    private final List<Rule> rules;

    public RouteTable(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RouteTable defaults() {
        return new RouteTable(List.of(
            Rule.segment("/login", PathClass.PUBLIC),
            Rule.segment("/register", PathClass.PUBLIC),
            Rule.prefix(AUTH_API_PREFIX, PathClass.PUBLIC),
            Rule.prefix("/_next", PathClass.PUBLIC),
            Rule.prefix("/static", PathClass.PUBLIC),
            Rule.prefix("/favicon", PathClass.PUBLIC),
            Rule.segment("/pending", PathClass.PENDING_PAGE),
            Rule.segment("/admin", PathClass.ADMIN),
            Rule.segment("/api/admin", PathClass.ADMIN)
        ));
    }

    public PathClass classify(String path) {
        String p = normalize(path);
        for (Rule rule : rules) {
            if (rule.matches(p)) {
                return rule.pathClass();
            }
        }
        return PathClass.PROTECTED;
    }

    /**
     * Endpoints under /api/auth/ stay reachable in every state.
     */
    public boolean isAuthInfrastructure(String path) {
        return normalize(path).startsWith(AUTH_API_PREFIX);
    }

    private static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }

    public record Rule(String path, PathClass pathClass, boolean plainPrefix) {
        public Rule {
            if (path == null || !path.startsWith("/")) {
                throw new IllegalArgumentException("path must start with '/'");
            }
            if (pathClass == null) {
                throw new IllegalArgumentException("pathClass is required");
            }
        }

        public static Rule segment(String path, PathClass pathClass) {
            return new Rule(path, pathClass, false);
        }

        public static Rule prefix(String path, PathClass pathClass) {
            return new Rule(path, pathClass, true);
        }

        boolean matches(String candidate) {
            if (plainPrefix) {
                return candidate.startsWith(path);
            }
            return candidate.equals(path) || candidate.startsWith(path + "/");
        }
    }
}
