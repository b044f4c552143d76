package work.signbox.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.signbox.api.ErrorKind;
import work.signbox.api.SigningException;
import work.signbox.api.SigningRequest;

/**
 * Chooses the signing entry point for a request. Rules are evaluated by descending priority,
 * ties in declaration order, first match wins. The rule set is an immutable snapshot that
 * {@link #reload(List)} swaps atomically.
 */
public final class DispatchRouter {
    private static final Logger log = LoggerFactory.getLogger(DispatchRouter.class);

    private volatile Snapshot snapshot;

    public DispatchRouter(List<DispatchRule> rules) {
        this.snapshot = Snapshot.of(rules);
    }

    /** Rules of the original Douyin sign server: replies and everything else. */
    public static List<DispatchRule> defaultRules() {
        return List.of(
            DispatchRule.contains("dy", "/reply", "sign_reply", 10),
            DispatchRule.regex("dy", ".*", "sign_detail", 0)
        );
    }

    public String resolve(SigningRequest request) {
        Objects.requireNonNull(request, "request");
        String uri = request.targetUri() == null ? "" : request.targetUri();
        String platform = request.platform() == null ? "" : request.platform().toLowerCase(Locale.ROOT);
        for (CompiledRule compiled : snapshot.rules()) {
            if (compiled.matches(platform, uri)) {
                return compiled.rule().entryPoint();
            }
        }
        log.warn("No dispatch rule matched platform={} uri={}", request.platform(), uri);
        throw new SigningException(ErrorKind.NO_RULE_MATCHED,
            "No dispatch rule matches " + request.platform() + " " + uri);
    }

    public void reload(List<DispatchRule> rules) {
        Snapshot next = Snapshot.of(rules);
        snapshot = next;
        log.info("Dispatch rules reloaded: {} rules, entry points {}", next.rules().size(), next.entryPoints());
    }

    /** Rules in evaluation order. */
    public List<DispatchRule> rules() {
        return snapshot.rules().stream().map(CompiledRule::rule).toList();
    }

    /** Distinct entry points referenced by the current rules; a script must define all of them. */
    public Set<String> entryPoints() {
        return snapshot.entryPoints();
    }

    private record Snapshot(List<CompiledRule> rules, Set<String> entryPoints) {
        static Snapshot of(List<DispatchRule> rules) {
            Objects.requireNonNull(rules, "rules");
            List<CompiledRule> compiled = new ArrayList<>(rules.size());
            for (DispatchRule rule : rules) {
                compiled.add(CompiledRule.of(Objects.requireNonNull(rule, "rule")));
            }
            // List.sort is stable, so equal priorities keep declaration order
            compiled.sort(Comparator.comparingInt((CompiledRule rule) -> rule.rule().priority()).reversed());
            Set<String> entryPoints = new LinkedHashSet<>();
            compiled.forEach(rule -> entryPoints.add(rule.rule().entryPoint()));
            return new Snapshot(List.copyOf(compiled), Collections.unmodifiableSet(entryPoints));
        }
    }

    private record CompiledRule(DispatchRule rule, Predicate<String> uriMatcher) {
        static CompiledRule of(DispatchRule rule) {
            Predicate<String> matcher = switch (rule.mode()) {
                case CONTAINS -> uri -> uri.contains(rule.pattern());
                case REGEX -> {
                    Pattern pattern = Pattern.compile(rule.pattern());
                    yield uri -> pattern.matcher(uri).find();
                }
            };
            return new CompiledRule(rule, matcher);
        }

        boolean matches(String platform, String uri) {
            if (rule.platform().isPresent() && !rule.platform().get().equals(platform)) {
                return false;
            }
            return uriMatcher.test(uri);
        }
    }
}
