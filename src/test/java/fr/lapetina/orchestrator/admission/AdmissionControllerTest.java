package fr.lapetina.orchestrator.admission;

import fr.lapetina.orchestrator.infrastructure.metrics.OutcomeWindow;
import fr.lapetina.orchestrator.support.ManualTickScheduler;
import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdmissionControllerTest {

    private static final String CHAT = "/api/ai/chat";
    private static final String IMAGE = "/api/ai/image";
    private static final long MINUTE = 60_000;

    private MutableClock clock;
    private SystemLoadMonitor loadMonitor;
    private AdmissionController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        loadMonitor = new SystemLoadMonitor(new OutcomeWindow(clock), clock, AdaptiveConfig.DEFAULT);
        controller = newController(null);
    }

    private AdmissionController newController(ContentValidator validator) {
        return new AdmissionController(defaultRules(), loadMonitor, null, clock, validator, AdmissionController.Settings.DEFAULT);
    }

    static List<RateLimitRule> defaultRules() {
        RateLimitRule chat = new RateLimitRule("ai_chat", "AI chat", CHAT, Map.of(
                UserTier.ANONYMOUS, TierLimit.slidingWindow(MINUTE, 5),
                UserTier.AUTHENTICATED, TierLimit.slidingWindow(MINUTE, 20),
                UserTier.PREMIUM, new TierLimit(MINUTE, 100, 10, RateLimitAlgorithm.TOKEN_BUCKET),
                UserTier.ENTERPRISE, TierLimit.of(MINUTE, 500, RateLimitAlgorithm.ADAPTIVE)
        ), 1, true, null);
        RateLimitRule image = new RateLimitRule("ai_image_generation", "AI image", IMAGE, Map.of(
                UserTier.ANONYMOUS, TierLimit.of(300_000, 1, RateLimitAlgorithm.LEAKY_BUCKET),
                UserTier.AUTHENTICATED, TierLimit.of(300_000, 3, RateLimitAlgorithm.LEAKY_BUCKET),
                UserTier.PREMIUM, TierLimit.of(300_000, 10, RateLimitAlgorithm.TOKEN_BUCKET),
                UserTier.ENTERPRISE, TierLimit.of(300_000, 50, RateLimitAlgorithm.ADAPTIVE)
        ), 2, true, null);
        RateLimitRule general = new RateLimitRule("general_api", "General API", "/api/*", Map.of(
                UserTier.ANONYMOUS, TierLimit.slidingWindow(MINUTE, 100),
                UserTier.AUTHENTICATED, TierLimit.slidingWindow(MINUTE, 1000),
                UserTier.PREMIUM, TierLimit.of(MINUTE, 5000, RateLimitAlgorithm.TOKEN_BUCKET),
                UserTier.ENTERPRISE, TierLimit.of(MINUTE, 20000, RateLimitAlgorithm.ADAPTIVE)
        ), 10, true, null);
        return List.of(chat, image, general);
    }

    @Nested
    @DisplayName("Sliding window")
    class SlidingWindow {

        @Test
        @DisplayName("should deny the sixth anonymous chat request within a minute")
        void shouldDenySixthRequest() {
            for (int i = 0; i < 5; i++) {
                AdmissionDecision decision = controller.check(CHAT, "anon-1", UserTier.ANONYMOUS);
                assertThat(decision.allowed()).isTrue();
                assertThat(decision.remaining()).isEqualTo(4 - i);
                assertThat(decision.ruleId()).isEqualTo("ai_chat");
            }

            AdmissionDecision denied = controller.check(CHAT, "anon-1", UserTier.ANONYMOUS);

            assertThat(denied.allowed()).isFalse();
            assertThat(denied.reason()).isEqualTo(DenialReason.RATE_LIMITED);
            assertThat(denied.remaining()).isZero();
            assertThat(denied.retryAfterSeconds()).isEqualTo(60L);
        }

        @Test
        @DisplayName("should warn when the last request of the window is used")
        void shouldWarnOnLastRequest() {
            for (int i = 0; i < 4; i++) {
                assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).warning()).isNull();
            }

            assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).warning()).isNotNull();
        }

        @Test
        @DisplayName("should admit again once old requests leave the window")
        void shouldAdmitAfterWindow() {
            for (int i = 0; i < 5; i++) {
                controller.check(CHAT, "anon-1", UserTier.ANONYMOUS);
                clock.advance(Duration.ofSeconds(10));
            }
            assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).allowed()).isFalse();

            clock.advance(Duration.ofSeconds(11));

            assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).allowed()).isTrue();
        }

        @Test
        @DisplayName("should keep separate state per identity and per tier limit")
        void shouldIsolateIdentities() {
            for (int i = 0; i < 5; i++) {
                controller.check(CHAT, "anon-1", UserTier.ANONYMOUS);
            }

            assertThat(controller.check(CHAT, "anon-2", UserTier.ANONYMOUS).allowed()).isTrue();
            AdmissionDecision authenticated = controller.check(CHAT, "u1", UserTier.AUTHENTICATED);
            assertThat(authenticated.allowed()).isTrue();
            assertThat(authenticated.limit()).isEqualTo(20);
        }
    }

    @Nested
    @DisplayName("Token bucket")
    class TokenBucket {

        @Test
        @DisplayName("should allow a burst up to capacity then refill over time")
        void shouldAllowBurstThenRefill() {
            for (int i = 0; i < 10; i++) {
                assertThat(controller.check(CHAT, "p1", UserTier.PREMIUM).allowed()).isTrue();
            }

            AdmissionDecision denied = controller.check(CHAT, "p1", UserTier.PREMIUM);
            assertThat(denied.allowed()).isFalse();
            assertThat(denied.limit()).isEqualTo(10);
            assertThat(denied.retryAfterSeconds()).isEqualTo(1L);

            clock.advanceMillis(700);

            assertThat(controller.check(CHAT, "p1", UserTier.PREMIUM).allowed()).isTrue();
            assertThat(controller.check(CHAT, "p1", UserTier.PREMIUM).allowed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Leaky bucket")
    class LeakyBucket {

        @Test
        @DisplayName("should drain at a constant rate")
        void shouldDrainAtConstantRate() {
            for (int i = 0; i < 3; i++) {
                assertThat(controller.check(IMAGE, "u1", UserTier.AUTHENTICATED).allowed()).isTrue();
            }
            assertThat(controller.check(IMAGE, "u1", UserTier.AUTHENTICATED).allowed()).isFalse();

            clock.advance(Duration.ofSeconds(50));

            assertThat(controller.check(IMAGE, "u1", UserTier.AUTHENTICATED).allowed()).isTrue();
            assertThat(controller.check(IMAGE, "u1", UserTier.AUTHENTICATED).allowed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Adaptive")
    class Adaptive {

        @Test
        @DisplayName("should use the full limit divided by rule priority at normal load")
        void shouldUseFullLimitAtNormalLoad() {
            RateLimitRule chat = controller.resolveRule(CHAT).orElseThrow();
            RateLimitRule image = controller.resolveRule(IMAGE).orElseThrow();

            assertThat(controller.effectiveMax(chat, chat.limitFor(UserTier.ENTERPRISE))).isEqualTo(500);
            assertThat(controller.effectiveMax(image, image.limitFor(UserTier.ENTERPRISE))).isEqualTo(25);
        }

        @Test
        @DisplayName("should shrink the limit while the system is overloaded")
        void shouldShrinkUnderLoad() {
            loadMonitor.simulateLoad(0.9);
            RateLimitRule chat = controller.resolveRule(CHAT).orElseThrow();

            assertThat(controller.effectiveMax(chat, chat.limitFor(UserTier.ENTERPRISE))).isEqualTo(250);
        }

        @Test
        @DisplayName("should never go below the minimum limit")
        void shouldRespectMinimumLimit() {
            loadMonitor.simulateLoad(1.0);
            RateLimitRule general = controller.resolveRule("/api/other").orElseThrow();
            RateLimitRule lowLimit = new RateLimitRule("tiny", "tiny", "/tiny", Map.of(
                    UserTier.ANONYMOUS, TierLimit.of(MINUTE, 20, RateLimitAlgorithm.ADAPTIVE),
                    UserTier.AUTHENTICATED, TierLimit.of(MINUTE, 20, RateLimitAlgorithm.ADAPTIVE),
                    UserTier.PREMIUM, TierLimit.of(MINUTE, 20, RateLimitAlgorithm.ADAPTIVE),
                    UserTier.ENTERPRISE, TierLimit.of(MINUTE, 20, RateLimitAlgorithm.ADAPTIVE)
            ), 5, true, null);

            assertThat(controller.effectiveMax(lowLimit, lowLimit.limitFor(UserTier.ENTERPRISE))).isEqualTo(10);
            assertThat(controller.effectiveMax(general, general.limitFor(UserTier.AUTHENTICATED))).isEqualTo(1000);
        }
    }

    @Nested
    @DisplayName("Blocking")
    class Blocking {

        @Test
        @DisplayName("should block a requester after repeated denials for one window")
        void shouldBlockAfterRepeatedDenials() {
            for (int i = 0; i < 5; i++) {
                controller.check(CHAT, "anon-1", UserTier.ANONYMOUS);
            }
            for (int i = 0; i < 3; i++) {
                assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).reason())
                        .isEqualTo(DenialReason.RATE_LIMITED);
            }

            AdmissionDecision blocked = controller.check(CHAT, "anon-1", UserTier.ANONYMOUS);
            assertThat(blocked.allowed()).isFalse();
            assertThat(blocked.reason()).isEqualTo(DenialReason.BLOCKED);
            assertThat(blocked.retryAfterSeconds()).isEqualTo(60L);

            clock.advanceMillis(MINUTE + 1);

            assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).allowed()).isTrue();
        }

        @Test
        @DisplayName("should lift a block when the identity state is cleared")
        void shouldLiftBlockOnClear() {
            for (int i = 0; i < 8; i++) {
                controller.check(CHAT, "anon-1", UserTier.ANONYMOUS);
            }
            assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).reason()).isEqualTo(DenialReason.BLOCKED);

            controller.clearIdentityState("anon-1");

            assertThat(controller.check(CHAT, "anon-1", UserTier.ANONYMOUS).allowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Rules")
    class Rules {

        @Test
        @DisplayName("should let the lowest priority number win")
        void shouldResolveByPriority() {
            assertThat(controller.resolveRule(CHAT)).map(RateLimitRule::id).contains("ai_chat");
            assertThat(controller.resolveRule("/api/users")).map(RateLimitRule::id).contains("general_api");
            assertThat(controller.getRules()).extracting(RateLimitRule::id)
                    .containsExactly("ai_chat", "ai_image_generation", "general_api");
        }

        @Test
        @DisplayName("should admit endpoints no rule covers without limit")
        void shouldAdmitUncoveredEndpoint() {
            AdmissionDecision decision = controller.check("/health", "anon-1", UserTier.ANONYMOUS);

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.limit()).isEqualTo(AdmissionDecision.UNLIMITED);
            assertThat(decision.ruleId()).isNull();
        }

        @Test
        @DisplayName("should ignore disabled and removed rules")
        void shouldIgnoreDisabledAndRemovedRules() {
            RateLimitRule chat = controller.resolveRule(CHAT).orElseThrow();
            controller.updateRule(new RateLimitRule(chat.id(), chat.name(), chat.pattern(), chat.limits(),
                    chat.priority(), false, chat.metadata()));

            assertThat(controller.resolveRule(CHAT)).map(RateLimitRule::id).contains("general_api");

            assertThat(controller.removeRule("general_api")).isTrue();
            assertThat(controller.resolveRule(CHAT)).isEmpty();
        }

        @Test
        @DisplayName("should reject updates of unknown rules")
        void shouldRejectUnknownUpdate() {
            RateLimitRule chat = controller.resolveRule(CHAT).orElseThrow();
            RateLimitRule unknown = new RateLimitRule("nope", null, "/nope", chat.limits(), 1, true, null);

            assertThatThrownBy(() -> controller.updateRule(unknown))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should match wildcard patterns consistently across checks")
        void shouldMatchWildcardPatterns() {
            RateLimitRule chat = controller.resolveRule(CHAT).orElseThrow();
            RateLimitRule stream = new RateLimitRule("stream", null, "/api/*/stream", chat.limits(), 1, true, null);
            RateLimitRule sameGlob = new RateLimitRule("stream-copy", null, "/api/*/stream", chat.limits(), 2, true, null);

            for (int i = 0; i < 3; i++) {
                assertThat(stream.matches("/api/ai/stream")).isTrue();
                assertThat(stream.matches("/api/ai/chat")).isFalse();
            }
            assertThat(sameGlob.matches("/api/v2/stream")).isTrue();
            assertThat(stream.matches("/api/*/stream/events")).isTrue();
            assertThat(stream.matches(null)).isFalse();
        }

        @Test
        @DisplayName("should require a limit for every tier")
        void shouldRequireEveryTier() {
            assertThatThrownBy(() -> new RateLimitRule("partial", null, "/x",
                    Map.of(UserTier.ANONYMOUS, TierLimit.slidingWindow(MINUTE, 1)), 1, true, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("AUTHENTICATED");
        }
    }

    @Nested
    @DisplayName("Content validation")
    class ContentValidation {

        @Test
        @DisplayName("should reject content refused by the validator")
        void shouldRejectContent() {
            AdmissionController validating = newController((endpoint, identity, content) ->
                    "forbidden".equals(content) ? Optional.of("Content not allowed") : Optional.empty());

            AdmissionDecision rejected = validating.check(CHAT, "u1", UserTier.AUTHENTICATED, "forbidden");
            assertThat(rejected.allowed()).isFalse();
            assertThat(rejected.reason()).isEqualTo(DenialReason.CONTENT_REJECTED);
            assertThat(rejected.warning()).isEqualTo("Content not allowed");

            assertThat(validating.check(CHAT, "u1", UserTier.AUTHENTICATED, "hello").allowed()).isTrue();
        }

        @Test
        @DisplayName("should fail open when the check itself fails")
        void shouldFailOpen() {
            AdmissionController broken = newController((endpoint, identity, content) -> {
                throw new IllegalStateException("validator down");
            });

            AdmissionDecision decision = broken.check(CHAT, "u1", UserTier.AUTHENTICATED, "hello");

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.warning()).contains("validator down");
        }
    }

    @Nested
    @DisplayName("Housekeeping")
    class Housekeeping {

        @Test
        @DisplayName("should count requests and denials per identity")
        void shouldCountRequests() {
            for (int i = 0; i < 6; i++) {
                controller.check(CHAT, null, null);
            }

            AdmissionStats stats = controller.getStats();
            assertThat(stats.totalRequests()).isEqualTo(6);
            assertThat(stats.blockedRequests()).isEqualTo(1);
            assertThat(stats.identities()).singleElement()
                    .satisfies(identity -> {
                        assertThat(identity.identity()).isEqualTo("anonymous");
                        assertThat(identity.tier()).isEqualTo(UserTier.ANONYMOUS);
                        assertThat(identity.blocked()).isEqualTo(1);
                    });
        }

        @Test
        @DisplayName("should drop limiter state idle for longer than the stale TTL")
        void shouldCleanupStaleStates() {
            controller.check(CHAT, "old", UserTier.ANONYMOUS);
            clock.advance(Duration.ofHours(23));
            controller.check(CHAT, "recent", UserTier.ANONYMOUS);
            clock.advance(Duration.ofHours(2));

            assertThat(controller.cleanupStaleStates()).isEqualTo(1);
            assertThat(controller.getStats().trackedStates()).isEqualTo(1);
        }

        @Test
        @DisplayName("should schedule the cleanup job")
        void shouldScheduleCleanup() {
            ManualTickScheduler scheduler = new ManualTickScheduler();

            controller.start(scheduler);

            assertThat(scheduler.isScheduled("admission-cleanup")).isTrue();
        }
    }
}
