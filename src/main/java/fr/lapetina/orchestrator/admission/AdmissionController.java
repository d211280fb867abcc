package fr.lapetina.orchestrator.admission;

import fr.lapetina.orchestrator.domain.model.RequestContext;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.scheduling.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides whether a request may proceed, per endpoint rule and requester tier.
 *
 * <p>Never blocks. The most specific enabled rule with the lowest priority number decides;
 * an endpoint no rule covers is unlimited. Errors inside the check fail open with a warning.
 * Requesters denied several times in a row are blocked for one window.
 */
public final class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private static final Comparator<RateLimitRule> RESOLUTION_ORDER = Comparator
            .comparingInt(RateLimitRule::priority)
            .thenComparing(Comparator.comparingInt(RateLimitRule::specificity).reversed())
            .thenComparing(RateLimitRule::id);

    private final Map<String, RateLimitRule> rules = new ConcurrentHashMap<>();
    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();
    private final RateLimitEvaluator evaluator = new RateLimitEvaluator();
    private final SystemLoadMonitor loadMonitor;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final ContentValidator contentValidator;
    private final Settings settings;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong blockedRequests = new AtomicLong();
    private final Map<String, IdentityCounter> identities;

    public AdmissionController(
            Collection<RateLimitRule> initialRules,
            SystemLoadMonitor loadMonitor,
            MetricsRegistry metrics,
            Clock clock,
            ContentValidator contentValidator,
            Settings settings
    ) {
        this.loadMonitor = Objects.requireNonNull(loadMonitor, "Load monitor is required");
        this.metrics = metrics;
        this.clock = clock;
        this.contentValidator = contentValidator;
        this.settings = settings != null ? settings : Settings.DEFAULT;
        int maxIdentities = this.settings.maxTrackedIdentities();
        this.identities = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, IdentityCounter> eldest) {
                return size() > maxIdentities;
            }
        };
        for (RateLimitRule rule : initialRules) {
            rules.put(rule.id(), rule);
        }
        log.info("Admission controller initialized: rules={}", rules.size());
    }

    /**
     * Schedules the stale state sweep.
     */
    public TickScheduler.Registration start(TickScheduler scheduler) {
        return scheduler.schedule("admission-cleanup", settings.cleanupInterval(), this::cleanupStaleStates);
    }

    public AdmissionDecision check(String endpoint, String identity, UserTier tier) {
        return check(endpoint, identity, tier, null);
    }

    /**
     * Checks a request, consulting the content validator first when one is configured.
     */
    public AdmissionDecision check(String endpoint, String identity, UserTier tier, Object content) {
        String requester = identity == null || identity.isBlank() ? RequestContext.ANONYMOUS : identity;
        UserTier effectiveTier = tier != null ? tier : UserTier.ANONYMOUS;
        Instant now = clock.instant();

        AdmissionDecision decision;
        try {
            decision = evaluate(endpoint, requester, effectiveTier, content, now);
        } catch (RuntimeException e) {
            log.warn("Admission check failed, allowing request: endpoint={}, identity={}, error={}",
                    endpoint, requester, e.getMessage(), e);
            decision = AdmissionDecision.failOpen(now, "Admission check failed: " + e.getMessage());
        }

        recordStats(requester, effectiveTier, decision, now);
        return decision;
    }

    private AdmissionDecision evaluate(String endpoint, String identity, UserTier tier, Object content, Instant now) {
        if (contentValidator != null) {
            Optional<String> rejection = contentValidator.validate(endpoint, identity, content);
            if (rejection.isPresent()) {
                log.info("Content rejected: endpoint={}, identity={}, reason={}", endpoint, identity, rejection.get());
                return AdmissionDecision.rejected(now, rejection.get());
            }
        }

        Optional<RateLimitRule> resolved = resolveRule(endpoint);
        if (resolved.isEmpty()) {
            return AdmissionDecision.unlimited(now);
        }
        RateLimitRule rule = resolved.get();
        TierLimit limit = rule.limitFor(tier);
        long nowMs = now.toEpochMilli();

        RateLimitState state = states.computeIfAbsent(identity + ":" + rule.id(), key -> new RateLimitState(nowMs));
        AdmissionDecision decision;
        synchronized (state) {
            state.lastSeenMs = nowMs;
            if (state.isBlocked(nowMs)) {
                decision = new AdmissionDecision(false, limit.maxRequests(), 0,
                        Instant.ofEpochMilli(state.blockedUntilMs),
                        RateLimitEvaluator.retryAfterSeconds(state.blockedUntilMs, nowMs),
                        "Temporarily blocked after repeated overage", DenialReason.BLOCKED, rule.id());
            } else {
                int effectiveMax = effectiveMax(rule, limit);
                RateLimitEvaluator.Evaluation evaluation = evaluator.evaluate(state, limit, effectiveMax, nowMs);
                decision = toDecision(rule, limit, state, evaluation, identity, nowMs);
            }
        }

        if (metrics != null) {
            metrics.incrementAdmission(rule.id(), tier.name(), decision.allowed());
        }
        if (!decision.allowed()) {
            log.debug("Request denied: endpoint={}, identity={}, tier={}, rule={}, reason={}, retryAfterSeconds={}",
                    endpoint, identity, tier, rule.id(), decision.reason(), decision.retryAfterSeconds());
        }
        return decision;
    }

    private AdmissionDecision toDecision(
            RateLimitRule rule,
            TierLimit limit,
            RateLimitState state,
            RateLimitEvaluator.Evaluation evaluation,
            String identity,
            long nowMs
    ) {
        Instant resetTime = Instant.ofEpochMilli(evaluation.resetAtMs());
        if (evaluation.allowed()) {
            state.consecutiveDenials = 0;
            String warning = evaluation.remaining() == 0 ? "Rate limit reached for the current window" : null;
            return new AdmissionDecision(true, evaluation.limit(), evaluation.remaining(), resetTime,
                    null, warning, null, rule.id());
        }

        state.consecutiveDenials++;
        String warning = "Rate limit exceeded (" + state.consecutiveDenials + "/"
                + settings.blockAfterConsecutiveDenials() + " before temporary block)";
        if (state.consecutiveDenials >= settings.blockAfterConsecutiveDenials()) {
            state.blockedUntilMs = nowMs + limit.windowMs();
            state.consecutiveDenials = 0;
            warning = "Temporarily blocked after repeated overage";
            log.warn("Requester blocked: identity={}, rule={}, blockedUntil={}",
                    identity, rule.id(), Instant.ofEpochMilli(state.blockedUntilMs));
        }
        return new AdmissionDecision(false, evaluation.limit(), 0, resetTime,
                evaluation.retryAfterSeconds(), warning, DenialReason.RATE_LIMITED, rule.id());
    }

    /**
     * Effective request limit: adaptive rules shrink under load and with the rule priority,
     * but never below the configured minimum.
     */
    int effectiveMax(RateLimitRule rule, TierLimit limit) {
        if (limit.algorithm() != RateLimitAlgorithm.ADAPTIVE) {
            return limit.maxRequests();
        }
        double factor = loadMonitor.loadFactor();
        int scaled = (int) Math.floor(limit.maxRequests() * factor / rule.priority());
        return Math.max(loadMonitor.getConfig().minLimit(), scaled);
    }

    /**
     * The rule deciding requests to {@code endpoint}, if any.
     */
    public Optional<RateLimitRule> resolveRule(String endpoint) {
        return rules.values().stream()
                .filter(RateLimitRule::enabled)
                .filter(rule -> rule.matches(endpoint))
                .min(RESOLUTION_ORDER);
    }

    private void recordStats(String identity, UserTier tier, AdmissionDecision decision, Instant now) {
        totalRequests.incrementAndGet();
        if (!decision.allowed()) {
            blockedRequests.incrementAndGet();
        }
        synchronized (identities) {
            IdentityCounter counter = identities.computeIfAbsent(identity, id -> new IdentityCounter());
            counter.tier = tier;
            counter.requests++;
            if (!decision.allowed()) {
                counter.blocked++;
            }
            counter.lastSeen = now;
        }
    }

    /**
     * Removes limiter states idle longer than the stale TTL.
     *
     * @return number of states removed
     */
    public int cleanupStaleStates() {
        long cutoff = clock.millis() - settings.staleStateTtl().toMillis();
        int removed = 0;
        for (Map.Entry<String, RateLimitState> entry : states.entrySet()) {
            RateLimitState state = entry.getValue();
            boolean stale;
            synchronized (state) {
                stale = state.lastSeenMs < cutoff;
            }
            if (stale && states.remove(entry.getKey(), state)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Stale rate limit states removed: count={}, remaining={}", removed, states.size());
        }
        return removed;
    }

    /**
     * Forgets all limiter state of a requester, lifting any block.
     */
    public void clearIdentityState(String identity) {
        String prefix = identity + ":";
        states.keySet().removeIf(key -> key.startsWith(prefix));
        synchronized (identities) {
            identities.remove(identity);
        }
        log.info("Rate limit state cleared: identity={}", identity);
    }

    /**
     * Adds a rule, replacing any rule with the same id.
     */
    public void addRule(RateLimitRule rule) {
        RateLimitRule previous = rules.put(rule.id(), rule);
        log.info("Rate limit rule {}: id={}, pattern={}, priority={}",
                previous == null ? "added" : "replaced", rule.id(), rule.pattern(), rule.priority());
    }

    /**
     * Replaces an existing rule.
     *
     * @throws IllegalArgumentException if no rule has the id
     */
    public void updateRule(RateLimitRule rule) {
        if (rules.replace(rule.id(), rule) == null) {
            throw new IllegalArgumentException("Unknown rate limit rule: " + rule.id());
        }
        log.info("Rate limit rule updated: id={}", rule.id());
    }

    public boolean removeRule(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) {
            log.info("Rate limit rule removed: id={}", ruleId);
        }
        return removed;
    }

    /**
     * All rules in resolution order.
     */
    public List<RateLimitRule> getRules() {
        List<RateLimitRule> sorted = new ArrayList<>(rules.values());
        sorted.sort(RESOLUTION_ORDER);
        return sorted;
    }

    public void updateAdaptiveConfig(AdaptiveConfig config) {
        loadMonitor.updateConfig(config);
    }

    public SystemLoadMonitor getLoadMonitor() {
        return loadMonitor;
    }

    public AdmissionStats getStats() {
        List<AdmissionStats.IdentityStats> perIdentity = new ArrayList<>();
        synchronized (identities) {
            identities.forEach((identity, counter) -> perIdentity.add(new AdmissionStats.IdentityStats(
                    identity, counter.tier, counter.requests, counter.blocked, counter.lastSeen)));
        }
        long total = totalRequests.get();
        long blocked = blockedRequests.get();
        return new AdmissionStats(
                total,
                blocked,
                total == 0 ? 0.0 : (double) blocked / total,
                states.size(),
                loadMonitor.getSystemLoad(),
                loadMonitor.loadFactor(),
                perIdentity
        );
    }

    /**
     * Restores the aggregate counters from a snapshot.
     */
    public void restoreCounters(long total, long blocked) {
        totalRequests.set(total);
        blockedRequests.set(blocked);
    }

    private static final class IdentityCounter {
        UserTier tier;
        long requests;
        long blocked;
        Instant lastSeen;
    }

    /**
     * Tunables of the controller.
     *
     * @param blockAfterConsecutiveDenials denials in a row before a one-window block
     * @param staleStateTtl                idle time after which limiter state is dropped
     * @param cleanupInterval              how often stale state is swept
     * @param maxTrackedIdentities         per-identity statistics kept, least recent dropped first
     */
    public record Settings(
            int blockAfterConsecutiveDenials,
            Duration staleStateTtl,
            Duration cleanupInterval,
            int maxTrackedIdentities
    ) {
        public static final Settings DEFAULT = new Settings(3, Duration.ofHours(24), Duration.ofHours(1), 1000);

        public Settings {
            if (blockAfterConsecutiveDenials < 1) {
                throw new IllegalArgumentException("blockAfterConsecutiveDenials must be positive");
            }
        }
    }
}
