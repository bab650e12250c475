package io.agentgovernor.budget;

import io.agentgovernor.config.BudgetSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Multi-dimensional budget accounting per actor with a reserve, then commit or release
 * protocol.
 *
 * <p>For every limited dimension {@code used + reserved <= limit} holds after each successful
 * {@link #reserve}. Requests that would break it are rejected whole, never truncated.
 *
 * <p>Period resets are lazy: {@link #checkBudget}, {@link #getRemaining} and
 * {@link #getUsage} zero {@code used} for any dimension whose period has elapsed, so these
 * reads mutate state.
 *
 * <p>Actors without an allocation are handled according to
 * {@link BudgetSettings#allowImplicitAllocation()}: allowed and lazily given an unbounded
 * default allocation, or denied.
 */
public final class BudgetEngine {
    private static final Logger log = LoggerFactory.getLogger(BudgetEngine.class);

    private final BudgetSettings settings;
    private final Clock clock;
    private final Map<String, Allocation> allocations = new HashMap<>();
    private final Map<String, BudgetReservation> reservations = new LinkedHashMap<>();

    public BudgetEngine(BudgetSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public BudgetEngine(BudgetSettings settings, Clock clock) {
        this.settings = settings == null ? BudgetSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        log.info("Budget engine initialized (implicitAllocation={}, defaultReservationTtl={})",
                this.settings.allowImplicitAllocation(), this.settings.defaultReservationTtl());
    }

    public Map<BudgetDimension, BudgetUsage> createAllocation(String actorId, BudgetLimit... limits) {
        return createAllocation(actorId, limits == null ? List.of() : Arrays.asList(limits));
    }

    /**
     * Creates or replaces the limits of {@code actorId}. Usage and outstanding reservations of
     * dimensions that stay limited are kept; those of dropped dimensions are discarded.
     */
    public synchronized Map<BudgetDimension, BudgetUsage> createAllocation(String actorId, Collection<BudgetLimit> limits) {
        requireActor(actorId);
        if (limits == null || limits.isEmpty()) {
            throw new IllegalArgumentException("At least one budget limit is required for " + actorId);
        }
        Instant now = clock.instant();
        Allocation allocation = allocations.computeIfAbsent(actorId, id -> new Allocation(id, now));
        allocation.limits.clear();
        for (BudgetLimit limit : limits) {
            allocation.limits.put(limit.dimension(), limit);
            allocation.usage.computeIfAbsent(limit.dimension(), d -> new Tracker(now));
        }
        allocation.usage.keySet().retainAll(allocation.limits.keySet());
        int dropped = 0;
        Iterator<BudgetReservation> it = reservations.values().iterator();
        while (it.hasNext()) {
            BudgetReservation reservation = it.next();
            if (reservation.actorId().equals(actorId) && !allocation.limits.containsKey(reservation.dimension())) {
                it.remove();
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Discarded {} reservations of {} on dimensions no longer limited", dropped, actorId);
        }
        allocation.updatedAt = now;
        log.info("Budget allocation created for {}: {}", actorId, describeLimits(allocation.limits));
        return allocation.snapshot();
    }

    public synchronized boolean hasAllocation(String actorId) {
        return allocations.containsKey(actorId);
    }

    public synchronized BudgetCheck checkBudget(String actorId, BudgetDimension dimension, double amount) {
        requireActor(actorId);
        requireDimension(dimension);
        requireAmount(amount);
        return check(actorId, dimension, amount, clock.instant());
    }

    public boolean reserve(String actorId, BudgetDimension dimension, double amount, String reservationId) {
        return reserve(actorId, dimension, amount, reservationId, null);
    }

    /**
     * Claims {@code amount} until the reservation is committed, released or expires.
     *
     * @param expiresIn null falls back to {@link BudgetSettings#defaultReservationTtl()}
     */
    public synchronized boolean reserve(
            String actorId,
            BudgetDimension dimension,
            double amount,
            String reservationId,
            Duration expiresIn
    ) {
        requireActor(actorId);
        requireDimension(dimension);
        requireAmount(amount);
        if (reservationId == null || reservationId.isBlank()) {
            throw new IllegalArgumentException("reservationId must not be blank");
        }
        if (expiresIn != null && (expiresIn.isZero() || expiresIn.isNegative())) {
            throw new IllegalArgumentException("expiresIn must be > 0: " + expiresIn);
        }
        if (reservations.containsKey(reservationId)) {
            log.warn("Reservation id already in use: {}", reservationId);
            return false;
        }
        Instant now = clock.instant();
        BudgetCheck check = check(actorId, dimension, amount, now);
        if (!check.ok()) {
            log.warn("Budget reservation failed for {}: {}", actorId, check.reason());
            return false;
        }
        Tracker tracker = trackerFor(actorId, dimension, now);
        tracker.reserved += amount;
        Duration ttl = expiresIn == null ? settings.defaultReservationTtl() : expiresIn;
        reservations.put(reservationId, new BudgetReservation(
                reservationId,
                actorId,
                dimension,
                amount,
                now,
                ttl == null ? null : now.plus(ttl)
        ));
        allocations.get(actorId).updatedAt = now;
        log.debug("Budget reserved: {} ({}={}, reservation={})", actorId, dimension.label(), amount, reservationId);
        return true;
    }

    public boolean commit(String reservationId) {
        return commit(reservationId, null);
    }

    /**
     * Charges a reservation. {@code actualAmount} may differ from the reserved amount; null
     * charges exactly what was reserved. An amount above the reservation is accepted only while
     * the excess fits into what is still available, otherwise the commit is refused and the
     * reservation stays outstanding.
     */
    public synchronized boolean commit(String reservationId, Double actualAmount) {
        if (actualAmount != null) {
            requireAmount(actualAmount);
        }
        BudgetReservation reservation = reservationId == null ? null : reservations.get(reservationId);
        if (reservation == null) {
            log.warn("Reservation not found: {}", reservationId);
            return false;
        }
        Allocation allocation = allocations.get(reservation.actorId());
        Tracker tracker = allocation == null ? null : allocation.usage.get(reservation.dimension());
        if (tracker == null) {
            log.error("Usage tracking missing for {} ({})", reservation.actorId(), reservation.dimension().label());
            reservations.remove(reservationId);
            return false;
        }
        double charged = actualAmount == null ? reservation.amount() : actualAmount;
        Instant now = clock.instant();
        BudgetLimit limit = allocation.limits.get(reservation.dimension());
        if (limit != null) {
            maybeReset(reservation.actorId(), limit, tracker, now);
            double excess = charged - reservation.amount();
            double available = limit.limit() - tracker.used - tracker.reserved;
            if (excess > 0.0d && excess > available) {
                log.warn("Commit refused for {} ({}): charge of {} exceeds reservation of {} by more than available {}",
                        reservation.actorId(), reservation.dimension().label(), charged, reservation.amount(), available);
                return false;
            }
        }
        tracker.reserved = Math.max(0.0d, tracker.reserved - reservation.amount());
        tracker.used += charged;
        reservations.remove(reservationId);
        allocation.updatedAt = now;
        log.debug("Budget committed: {} ({}={})", reservation.actorId(), reservation.dimension().label(), charged);
        return true;
    }

    public synchronized boolean release(String reservationId) {
        BudgetReservation reservation = reservationId == null ? null : reservations.remove(reservationId);
        if (reservation == null) {
            log.warn("Reservation not found: {}", reservationId);
            return false;
        }
        releaseClaim(reservation);
        log.debug("Budget reservation released: {} ({}={})",
                reservation.actorId(), reservation.dimension().label(), reservation.amount());
        return true;
    }

    /**
     * Charges usage that was never reserved. Returns false when the dimension has no limit for
     * the actor and implicit allocation is disabled.
     */
    public synchronized boolean recordUsage(String actorId, BudgetDimension dimension, double amount) {
        requireActor(actorId);
        requireDimension(dimension);
        requireAmount(amount);
        Instant now = clock.instant();
        Allocation allocation = allocations.get(actorId);
        boolean limited = allocation != null && allocation.limits.containsKey(dimension);
        if (!limited && !settings.allowImplicitAllocation()) {
            log.warn("No {} budget allocation for {}, usage of {} not recorded", dimension.label(), actorId, amount);
            return false;
        }
        Tracker tracker = trackerFor(actorId, dimension, now);
        BudgetLimit limit = allocations.get(actorId).limits.get(dimension);
        if (limit != null) {
            maybeReset(actorId, limit, tracker, now);
        }
        tracker.used += amount;
        allocations.get(actorId).updatedAt = now;
        log.debug("Budget usage recorded: {} ({}={})", actorId, dimension.label(), amount);
        return true;
    }

    /**
     * Remaining amount for a limited dimension, or empty when the actor has no allocation or
     * the dimension has no limit.
     */
    public synchronized OptionalDouble getRemaining(String actorId, BudgetDimension dimension) {
        Allocation allocation = allocations.get(actorId);
        if (allocation == null) {
            return OptionalDouble.empty();
        }
        BudgetLimit limit = allocation.limits.get(dimension);
        if (limit == null) {
            return OptionalDouble.empty();
        }
        Tracker tracker = allocation.usage.get(dimension);
        if (tracker == null) {
            return OptionalDouble.of(limit.limit());
        }
        maybeReset(actorId, limit, tracker, clock.instant());
        return OptionalDouble.of(Math.max(0.0d, limit.limit() - tracker.used - tracker.reserved));
    }

    public synchronized Map<BudgetDimension, BudgetUsage> getUsage(String actorId) {
        Allocation allocation = allocations.get(actorId);
        if (allocation == null) {
            return Map.of();
        }
        Instant now = clock.instant();
        allocation.limits.forEach((dimension, limit) -> {
            Tracker tracker = allocation.usage.get(dimension);
            if (tracker != null) {
                maybeReset(actorId, limit, tracker, now);
            }
        });
        return allocation.snapshot();
    }

    public synchronized Optional<BudgetUsage> getUsage(String actorId, BudgetDimension dimension) {
        return Optional.ofNullable(getUsage(actorId).get(dimension));
    }

    /**
     * Zeroes {@code used} for one dimension, or for all when {@code dimension} is null.
     * Outstanding reservations are left in place.
     */
    public synchronized boolean resetBudget(String actorId, BudgetDimension dimension) {
        Allocation allocation = allocations.get(actorId);
        if (allocation == null) {
            log.warn("Reset requested for actor without allocation: {}", actorId);
            return false;
        }
        Instant now = clock.instant();
        if (dimension != null) {
            Tracker tracker = allocation.usage.get(dimension);
            if (tracker == null) {
                return false;
            }
            tracker.used = 0.0d;
            tracker.lastResetAt = now;
            log.info("Budget reset for {} ({})", actorId, dimension.label());
            return true;
        }
        for (Tracker tracker : allocation.usage.values()) {
            tracker.used = 0.0d;
            tracker.lastResetAt = now;
        }
        log.info("All budgets reset for {}", actorId);
        return true;
    }

    /**
     * Releases every reservation whose expiry has passed.
     */
    public synchronized int cleanupExpired() {
        Instant now = clock.instant();
        List<BudgetReservation> expired = new ArrayList<>();
        for (BudgetReservation reservation : reservations.values()) {
            if (reservation.expired(now)) {
                expired.add(reservation);
            }
        }
        for (BudgetReservation reservation : expired) {
            reservations.remove(reservation.reservationId());
            releaseClaim(reservation);
        }
        if (!expired.isEmpty()) {
            log.info("Cleaned up {} expired reservations", expired.size());
        }
        return expired.size();
    }

    public synchronized Optional<BudgetReservation> getReservation(String reservationId) {
        return Optional.ofNullable(reservationId == null ? null : reservations.get(reservationId));
    }

    public synchronized int reservationCount() {
        return reservations.size();
    }

    public synchronized int allocationCount() {
        return allocations.size();
    }

    public BudgetSettings settings() {
        return settings;
    }

    public static double tokenCost(String model, long promptTokens, long completionTokens) {
        return TokenPricing.tokenCost(model, promptTokens, completionTokens);
    }

    private BudgetCheck check(String actorId, BudgetDimension dimension, double amount, Instant now) {
        Allocation allocation = allocations.get(actorId);
        if (allocation == null) {
            if (settings.allowImplicitAllocation()) {
                return BudgetCheck.allowed();
            }
            log.warn("No budget allocation for actor {}", actorId);
            return BudgetCheck.denied("No budget allocation for actor " + actorId);
        }
        BudgetLimit limit = allocation.limits.get(dimension);
        if (limit == null) {
            if (settings.allowImplicitAllocation()) {
                return BudgetCheck.allowed();
            }
            return BudgetCheck.denied("No " + dimension.label() + " limit configured for actor " + actorId);
        }
        Tracker tracker = allocation.usage.computeIfAbsent(dimension, d -> new Tracker(now));
        maybeReset(actorId, limit, tracker, now);

        double committed = tracker.used + tracker.reserved;
        double available = limit.limit() - committed;
        if (amount > available) {
            log.warn("Budget exceeded for {} ({}): requested={}, available={}",
                    actorId, dimension.label(), amount, available);
            return BudgetCheck.denied("Insufficient " + dimension.label() + " budget (requested="
                    + amount + ", available=" + available + ")");
        }
        if (limit.softLimit() != null && committed + amount >= limit.softLimit()) {
            log.warn("Soft budget limit reached for {} ({}): {}/{}",
                    actorId, dimension.label(), committed + amount, limit.limit());
            return BudgetCheck.allowedNearLimit();
        }
        return BudgetCheck.allowed();
    }

    // Only called after check() allowed the request, so a missing tracker implies implicit mode.
    private Tracker trackerFor(String actorId, BudgetDimension dimension, Instant now) {
        Allocation allocation = allocations.get(actorId);
        if (allocation == null) {
            log.warn("No allocation for {}, creating default", actorId);
            allocation = new Allocation(actorId, now);
            allocations.put(actorId, allocation);
        }
        if (!allocation.limits.containsKey(dimension)) {
            allocation.limits.put(dimension, BudgetLimit.unbounded(dimension, settings.implicitPeriod()));
        }
        return allocation.usage.computeIfAbsent(dimension, d -> new Tracker(now));
    }

    private void releaseClaim(BudgetReservation reservation) {
        Allocation allocation = allocations.get(reservation.actorId());
        Tracker tracker = allocation == null ? null : allocation.usage.get(reservation.dimension());
        if (tracker != null) {
            tracker.reserved = Math.max(0.0d, tracker.reserved - reservation.amount());
            allocation.updatedAt = clock.instant();
        }
    }

    private void maybeReset(String actorId, BudgetLimit limit, Tracker tracker, Instant now) {
        Duration elapsed = Duration.between(tracker.lastResetAt, now);
        if (elapsed.compareTo(limit.period()) >= 0) {
            tracker.used = 0.0d;
            tracker.lastResetAt = now;
            log.info("Budget auto-reset for {} ({}) after {}", actorId, limit.dimension().label(), limit.period());
        }
    }

    private static String describeLimits(Map<BudgetDimension, BudgetLimit> limits) {
        StringBuilder sb = new StringBuilder();
        limits.forEach((dimension, limit) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(dimension.label()).append('=').append(limit.limit());
        });
        return sb.toString();
    }

    private static void requireActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId must not be blank");
        }
    }

    private static void requireDimension(BudgetDimension dimension) {
        if (dimension == null) {
            throw new IllegalArgumentException("dimension must not be null");
        }
    }

    private static void requireAmount(double amount) {
        if (amount < 0.0d || Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("amount must be a finite value >= 0: " + amount);
        }
    }

    private static final class Allocation {
        private final String actorId;
        private final Map<BudgetDimension, BudgetLimit> limits = new EnumMap<>(BudgetDimension.class);
        private final Map<BudgetDimension, Tracker> usage = new EnumMap<>(BudgetDimension.class);
        private final Instant createdAt;
        private Instant updatedAt;

        private Allocation(String actorId, Instant createdAt) {
            this.actorId = actorId;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        private Map<BudgetDimension, BudgetUsage> snapshot() {
            Map<BudgetDimension, BudgetUsage> out = new EnumMap<>(BudgetDimension.class);
            usage.forEach((dimension, tracker) -> {
                BudgetLimit limit = limits.get(dimension);
                out.put(dimension, new BudgetUsage(
                        dimension,
                        limit == null ? Double.POSITIVE_INFINITY : limit.limit(),
                        tracker.used,
                        tracker.reserved,
                        tracker.lastResetAt
                ));
            });
            return out;
        }

        @Override
        public String toString() {
            return "Allocation[" + actorId + ", created=" + createdAt + ", updated=" + updatedAt + "]";
        }
    }

    private static final class Tracker {
        private double used;
        private double reserved;
        private Instant lastResetAt;

        private Tracker(Instant lastResetAt) {
            this.lastResetAt = lastResetAt;
        }
    }
}
