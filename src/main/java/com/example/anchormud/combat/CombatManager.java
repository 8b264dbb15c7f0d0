package com.example.anchormud.combat;

import com.example.anchormud.event.EventScheduler;
import com.example.anchormud.event.SpawnService;
import com.example.anchormud.model.CombatModifier;
import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.EntityPosition;
import com.example.anchormud.model.ItemInstance;
import com.example.anchormud.model.ManeuverDefinition;
import com.example.anchormud.model.PlayerCharacter;
import com.example.anchormud.model.RangeBand;
import com.example.anchormud.model.ReactionTrigger;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.RoomFlag;
import com.example.anchormud.model.ThreatProfile;
import com.example.anchormud.net.GameMessage;
import com.example.anchormud.net.MessageType;
import com.example.anchormud.net.Outbox;
import com.example.anchormud.persistence.WorldContent;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.GameConfig;
import com.example.anchormud.util.OpposedCheck;
import com.example.anchormud.util.TickService;
import com.example.anchormud.util.WeatherService;
import com.example.anchormud.world.EntityRegistry;
import com.example.anchormud.world.RoomLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs every combat session in the world.
 *
 * Intents (attack, maneuver, disengage, join, minor actions) are validated and
 * applied under the actor's room lock. A pulse from the tick service resolves
 * each session's round once its window has elapsed, in fixed phase order:
 * action, reaction, resolution, summary. Attack tickers only accumulate swings;
 * swings are resolved in the action phase and damage lands in resolution.
 *
 * Messages produced under a lock are collected in an {@link Outbox} and handed
 * to the message dispatcher after the lock is released.
 */
public class CombatManager {
    private static final Logger logger = LoggerFactory.getLogger(CombatManager.class);

    private final GameClock clock;
    private final EntityRegistry registry;
    private final RoomLockManager locks;
    private final WorldContent content;
    private final WeatherService weather;
    private final SpawnService spawns;
    private final EventScheduler scheduler;
    private final AttackTickerService tickers;
    private final CombatCalculator calculator;
    private final DisengageResolver disengageResolver;
    private final PursuitResolver pursuitResolver = new PursuitResolver();

    private final long roundMillis;
    private final long pulseMillis;
    private final long fleeWindowMillis;
    private final long disengageTimeoutMillis;
    private final int maxReactions;
    private final double baseIntervalSeconds;
    private final LeaveMode leaveMode;

    /** Active sessions keyed by room */
    private final Map<String, Combat> combatsByRoom = new ConcurrentHashMap<>();

    /** Open flee windows keyed by combatant ref */
    private final Map<String, FleeWindow> fleeWindows = new ConcurrentHashMap<>();

    private final AtomicLong combatIdGenerator = new AtomicLong(1);

    /** Receives each outbox once its lock has been released */
    private volatile Consumer<Outbox> messageDispatcher = out -> { };

    /** Maps a player ref to its session id, for loot reservation */
    private volatile Function<String, String> sessionResolver = ref -> null;

    /** Handles a defeated player after the room lock is released */
    private volatile Consumer<PlayerCharacter> defeatHandler = pc -> { };

    /** Damage waiting for the resolution phase. */
    private record PendingDamage(CombatResult result, CombatModifier modifier) {}

    /** One attack made in the action phase, for ON_ATTACKED reactions. */
    private record AttackEvent(String attackerRef, String defenderRef) {}

    /** Side effects collected while a room lock is held. */
    private static final class Step {
        final Outbox out = new Outbox();
        final List<PlayerCharacter> defeated = new ArrayList<>();
    }

    public CombatManager(GameClock clock, EntityRegistry registry, RoomLockManager locks, WorldContent content,
                         WeatherService weather, SpawnService spawns, EventScheduler scheduler,
                         GameConfig config, Random rng) {
        this.clock = clock;
        this.registry = registry;
        this.locks = locks;
        this.content = content;
        this.weather = weather;
        this.spawns = spawns;
        this.scheduler = scheduler;
        this.calculator = new CombatCalculator(rng);
        this.disengageResolver = new DisengageResolver(rng, config.disengageDifficulty());
        this.roundMillis = config.roundMillis();
        this.pulseMillis = config.pulseMillis();
        this.fleeWindowMillis = config.fleeWindowMillis();
        this.disengageTimeoutMillis = config.disengageTimeoutMillis();
        this.maxReactions = config.maxReactionsPerRound();
        this.baseIntervalSeconds = config.baseAttackIntervalSeconds();
        this.leaveMode = config.getEnum(GameConfig.LEAVE_MODE, LeaveMode.class, LeaveMode.DISENGAGE_AND_PURSUIT);
        this.tickers = new AttackTickerService(clock, scheduler);
        this.tickers.setFireHandler(this::onTickerFire);
    }

    /**
     * Register the combat pulse with the tick service.
     */
    public void initialize(TickService tickService) {
        tickService.scheduleAtFixedRate("combat-pulse", this::tick, pulseMillis, pulseMillis);
        logger.info("[CombatManager] Initialized ({}ms pulse, {}ms rounds, leave mode {})",
                pulseMillis, roundMillis, leaveMode);
    }

    public void setMessageDispatcher(Consumer<Outbox> dispatcher) {
        this.messageDispatcher = dispatcher;
    }

    public void setSessionResolver(Function<String, String> resolver) {
        this.sessionResolver = resolver;
    }

    public void setDefeatHandler(Consumer<PlayerCharacter> handler) {
        this.defeatHandler = handler;
    }

    // ========== Pulse ==========

    /**
     * Resolve every session whose round window has elapsed, then expire
     * disengage attempts and flee windows.
     */
    public void tick() {
        for (String roomId : new ArrayList<>(combatsByRoom.keySet())) {
            try {
                processRoom(roomId);
            } catch (RuntimeException e) {
                logger.error("[CombatManager] Error processing combat in {}", roomId, e);
            }
        }
        long now = clock.nowMillis();
        for (FleeWindow window : new ArrayList<>(fleeWindows.values())) {
            if (!window.isOpen(now)) {
                expireFleeWindow(window);
            }
        }
    }

    private void processRoom(String roomId) {
        Step step = new Step();
        locks.runInRoom(roomId, () -> {
            Combat combat = combatsByRoom.get(roomId);
            if (combat == null || !combat.isActive()) return;
            long now = clock.nowMillis();
            expireDisengageAttempts(combat, now, step);
            if (combat.isRoundDue(now, roundMillis)) {
                processRound(combat, step);
            }
        });
        flush(step);
    }

    private void expireDisengageAttempts(Combat combat, long now, Step step) {
        for (CombatParticipant p : new ArrayList<>(combat.getParticipants())) {
            if (p.getState() == ParticipantState.DISENGAGING && p.getDisengageDeadline() >= 0
                    && now >= p.getDisengageDeadline()) {
                String target = p.getPreDisengageTarget();
                p.clearDisengage();
                p.setPrimary(null);
                p.setState(ParticipantState.ENGAGED);
                step.out.to(p.getRef(), MessageType.STATE, "You fail to find an opening in time and are drawn back into the fight.");
                restoreTarget(combat, p, target, step);
            }
        }
    }

    private void expireFleeWindow(FleeWindow window) {
        Step step = new Step();
        locks.runInRoom(window.roomId(), () -> {
            if (!fleeWindows.remove(window.ref(), window)) return;
            if (!window.roomId().equals(registry.roomOf(window.ref()))) return;
            Combatant fugitive = combatant(window.ref());
            if (fugitive == null || !fugitive.isAlive()) return;
            Combatant opponent = null;
            for (String ref : window.opponents()) {
                Combatant c = combatant(ref);
                if (c != null && c.isAlive() && window.roomId().equals(registry.roomOf(ref))) {
                    opponent = c;
                    break;
                }
            }
            if (opponent == null) {
                step.out.to(window.ref(), MessageType.NOTICE, "The moment to flee passes; nobody is left to chase you.");
                return;
            }
            step.out.to(window.ref(), MessageType.STATE, "You hesitated too long. " + opponent.getName() + " closes back in!");
            engageInternal(window.roomId(), opponent, fugitive, step);
        });
        flush(step);
    }

    // ========== Round protocol ==========

    private void processRound(Combat combat, Step step) {
        String roomId = combat.getRoomId();
        int round = combat.getCurrentRound();
        List<PendingDamage> queued = new ArrayList<>();
        List<AttackEvent> attacks = new ArrayList<>();
        Map<String, OpposedCheck.Result> disengages = new LinkedHashMap<>();
        List<String> notable = new ArrayList<>();

        // Action phase: initiative order, then late joiners
        for (CombatParticipant p : combat.actionQueue()) {
            Combatant c = combatant(p.getRef());
            if (c == null || !c.isAlive() || !roomId.equals(registry.roomOf(p.getRef()))) {
                continue;
            }
            if (!c.isPlayer()) {
                runCreatureTurn(combat, p, c, step);
            }
            PendingAction action = p.getPrimary();
            if (action != null && action.kind() == PendingAction.Kind.DISENGAGE) {
                p.takeSwings();
                disengages.put(p.getRef(), rollDisengage(combat, p, c));
            } else if (action != null && action.kind() == PendingAction.Kind.MANEUVER) {
                p.takeSwings();
                resolveManeuver(combat, p, c, action, queued, attacks, step);
            } else {
                int swings = p.takeSwings();
                for (int i = 0; i < swings; i++) {
                    String targetRef = targetOf(p.getRef());
                    if (targetRef == null || checkTarget(roomId, c, targetRef) != null) break;
                    Combatant target = combatant(targetRef);
                    CombatResult result = calculator.resolveAttack(c, target, c.getAttack(),
                            effectiveAccuracy(c, p, c.getAttack().ranged(), roomId),
                            effectiveAvoidance(target, combat.getParticipant(targetRef)), 1.0);
                    queued.add(new PendingDamage(result, null));
                    attacks.add(new AttackEvent(c.getRef(), targetRef));
                }
            }
        }

        // Reaction phase: bounded per participant, reactions never provoke reactions
        for (AttackEvent a : attacks) {
            react(combat, a.defenderRef(), a.attackerRef(), ReactionTrigger.ON_ATTACKED, queued, step);
        }
        for (String fugitive : disengages.keySet()) {
            for (CombatParticipant o : new ArrayList<>(combat.getParticipants())) {
                if (fugitive.equals(targetOf(o.getRef()))) {
                    react(combat, o.getRef(), fugitive, ReactionTrigger.ON_DISENGAGE, queued, step);
                }
            }
        }

        // Resolution phase
        for (PendingDamage d : queued) {
            applyDamage(combat, d, round, step, notable);
        }
        for (Map.Entry<String, OpposedCheck.Result> e : disengages.entrySet()) {
            CombatParticipant p = combat.getParticipant(e.getKey());
            if (p != null) {
                finishDisengage(combat, p, e.getValue(), step, notable);
            }
        }
        for (CombatParticipant p : combat.getParticipants()) {
            p.expireModifiers(round);
            p.resetRound();
        }
        for (CombatParticipant p : new ArrayList<>(combat.getParticipants())) {
            if (p.getState() == ParticipantState.ENGAGED) {
                Combatant c = combatant(p.getRef());
                String t = targetOf(p.getRef());
                if (c != null && (t == null || !isValidOpponent(combat, roomId, c, t))) {
                    tickers.cancel(p.getRef(), "target invalid");
                    retarget(combat, p, step);
                }
            }
        }

        // Summary phase
        sendSummary(combat, round, notable, step);

        if (!hasHostilities(combat)) {
            endCombat(combat, step);
        } else {
            combat.advanceRound(clock.nowMillis());
        }
    }

    private void runCreatureTurn(Combat combat, CombatParticipant p, Combatant c, Step step) {
        if (p.getState() != ParticipantState.ENGAGED) return;
        String roomId = combat.getRoomId();
        String current = targetOf(p.getRef());
        String best = chooseTarget(combat, roomId, c, p);
        if (best == null) {
            retarget(combat, p, step);
            return;
        }
        if (!best.equals(current)) {
            setTarget(p.getRef(), best);
            if (tickers.isTicking(p.getRef())) {
                tickers.start(p.getRef(), best, interval(c));
            }
        }
        boolean ranged = c.getAttack().ranged();
        if (!inRange(p.getRef(), ranged) && !p.isMinorUsed() && !p.isMovementBlocked()) {
            setBand(p.getRef(), bandOf(p.getRef()).closer());
            p.useMinor();
            Combatant target = combatant(best);
            step.out.toAll(playerRefs(roomId), new GameMessage(MessageType.NOTICE,
                    c.getName() + " closes in on " + (target == null ? "its foe" : target.getName()) + "."));
        }
        if (inRange(p.getRef(), ranged) && !tickers.isTicking(p.getRef())) {
            tickers.start(p.getRef(), best, interval(c));
        }
    }

    private void resolveManeuver(Combat combat, CombatParticipant p, Combatant c, PendingAction action,
                                 List<PendingDamage> queued, List<AttackEvent> attacks, Step step) {
        ManeuverDefinition m = action.maneuver();
        String roomId = combat.getRoomId();
        String targetRef = action.targetRef() != null ? action.targetRef() : targetOf(p.getRef());
        boolean ranged = m.ranged() || c.getAttack().ranged();
        if (targetRef == null || checkTarget(roomId, c, targetRef) != null || !inRange(p.getRef(), ranged)) {
            c.refundStamina(m.staminaCost());
            step.out.to(p.getRef(), MessageType.NOTICE, "Your " + m.name() + " finds no target.");
            return;
        }
        Combatant target = combatant(targetRef);
        CombatResult result = calculator.resolveAttack(c, target, c.getAttack(),
                effectiveAccuracy(c, p, ranged, roomId) + m.accuracyBonus(),
                effectiveAvoidance(target, combat.getParticipant(targetRef)), m.damageMultiplier())
                .withManeuver(m.name());
        queued.add(new PendingDamage(result, m.appliesModifier()));
        attacks.add(new AttackEvent(c.getRef(), targetRef));
    }

    private void react(Combat combat, String reactorRef, String provokerRef, ReactionTrigger trigger,
                       List<PendingDamage> queued, Step step) {
        CombatParticipant p = combat.getParticipant(reactorRef);
        if (p == null || p.getReadied() == null || p.getReadied().reaction() != trigger) return;
        if (p.getReactionsUsed() >= maxReactions) return;
        String roomId = combat.getRoomId();
        Combatant reactor = combatant(reactorRef);
        if (reactor == null || !reactor.isAlive() || checkTarget(roomId, reactor, provokerRef) != null) return;
        ManeuverDefinition m = p.getReadied();
        boolean ranged = m.ranged() || reactor.getAttack().ranged();
        if (!inRange(reactorRef, ranged)) return;
        p.setReadied(null);
        if (!reactor.spendStamina(m.staminaCost())) {
            step.out.to(reactorRef, MessageType.NOTICE, "You are too winded to " + m.name() + ".");
            return;
        }
        p.useReaction();
        Combatant provoker = combatant(provokerRef);
        CombatResult result = calculator.resolveAttack(reactor, provoker, reactor.getAttack(),
                effectiveAccuracy(reactor, p, ranged, roomId) + m.accuracyBonus(),
                effectiveAvoidance(provoker, combat.getParticipant(provokerRef)), m.damageMultiplier())
                .withManeuver(m.name());
        queued.add(new PendingDamage(result, m.appliesModifier()));
    }

    private void applyDamage(Combat combat, PendingDamage d, int round, Step step, List<String> notable) {
        CombatResult r = d.result();
        Combatant target = combatant(r.getTargetRef());
        if (target == null || !target.isAlive()) return;
        String roomId = combat.getRoomId();
        MessageType type = !r.isHit() ? MessageType.MISS : r.isCritical() ? MessageType.CRITICAL : MessageType.HIT;
        step.out.toAll(playerRefs(roomId), new GameMessage(type, r.describe()));
        CombatParticipant tp = combat.getParticipant(target.getRef());
        if (!r.isHit()) {
            if (tp != null) tp.addThreat(r.getAttackerRef(), 0);
            return;
        }
        int taken = target.applyDamage(r.getDamage());
        if (tp != null) {
            tp.addThreat(r.getAttackerRef(), taken);
            if (d.modifier() != null && target.isAlive()) {
                tp.addModifier(d.modifier(), round + 1);
                notable.add(target.getName() + " is " + d.modifier().getDisplayName() + ".");
            }
        }
        if (!target.isAlive()) {
            handleDeath(combat, target, r.getAttackerRef(), step, notable);
        }
    }

    private OpposedCheck.Result rollDisengage(Combat combat, CombatParticipant p, Combatant c) {
        List<Integer> opposition = new ArrayList<>();
        String roomId = combat.getRoomId();
        for (CombatParticipant o : combat.getParticipants()) {
            if (!c.getRef().equals(targetOf(o.getRef()))) continue;
            Combatant oc = combatant(o.getRef());
            if (oc != null && oc.isAlive() && oc.isHostileTo(c) && o.getState().isActive()) {
                opposition.add(effectiveAccuracy(oc, o, oc.getAttack().ranged(), roomId));
            }
        }
        int weatherPenalty = 0;
        Room room = content.getRoom(roomId);
        if (weather != null && room != null) {
            weatherPenalty = weather.disengageDifficultyModifier(room.getRegionId(), room.getExposure());
        }
        return disengageResolver.resolve(effectiveAvoidance(c, p), opposition, weatherPenalty);
    }

    private void finishDisengage(Combat combat, CombatParticipant p, OpposedCheck.Result check,
                                 Step step, List<String> notable) {
        Combatant c = combatant(p.getRef());
        if (c == null || !c.isAlive() || p.getState() != ParticipantState.DISENGAGING) return;
        String roomId = combat.getRoomId();
        if (check.succeeded()) {
            List<String> opponents = new ArrayList<>();
            for (CombatParticipant o : combat.getParticipants()) {
                Combatant oc = combatant(o.getRef());
                if (oc != null && oc.isAlive() && oc.isHostileTo(c) && c.getRef().equals(targetOf(o.getRef()))) {
                    opponents.add(o.getRef());
                }
            }
            tickers.cancel(p.getRef(), "disengaged");
            p.clearDisengage();
            p.setState(ParticipantState.OBSERVING);
            clearCombatPosition(p.getRef());
            FleeWindow window = new FleeWindow(p.getRef(), roomId, clock.nowMillis() + fleeWindowMillis, opponents);
            fleeWindows.put(p.getRef(), window);
            step.out.to(p.getRef(), MessageType.STATE, "You break away from the fight! You have "
                    + (fleeWindowMillis / 1000) + " seconds to get clear.");
            notable.add(c.getName() + " breaks away.");
            for (String ref : opponents) {
                CombatParticipant o = combat.getParticipant(ref);
                if (o != null) {
                    tickers.cancel(ref, "target broke away");
                    retarget(combat, o, step);
                }
            }
        } else {
            String target = p.getPreDisengageTarget();
            p.clearDisengage();
            p.setState(ParticipantState.ENGAGED);
            step.out.to(p.getRef(), MessageType.STATE, "You fail to break away!");
            notable.add(c.getName() + " fails to break away.");
            restoreTarget(combat, p, target, step);
        }
    }

    private void restoreTarget(Combat combat, CombatParticipant p, String target, Step step) {
        Combatant c = combatant(p.getRef());
        if (c != null && target != null && isValidOpponent(combat, combat.getRoomId(), c, target)) {
            setTarget(p.getRef(), target);
            if (inRange(p.getRef(), c.getAttack().ranged())) {
                tickers.start(p.getRef(), target, interval(c));
            }
        } else {
            retarget(combat, p, step);
        }
    }

    private void sendSummary(Combat combat, int round, List<String> notable, Step step) {
        int hostiles = 0;
        for (CombatParticipant p : combat.getParticipants()) {
            Combatant c = combatant(p.getRef());
            if (c != null && !c.isPlayer() && c.isAlive() && p.getState().isActive()) hostiles++;
        }
        StringBuilder sb = new StringBuilder("[Round ").append(round).append("] ");
        if (hostiles == 0) {
            sb.append("No hostiles remain.");
        } else {
            sb.append(hostiles).append(hostiles == 1 ? " hostile remains." : " hostiles remain.");
        }
        for (String line : notable) {
            sb.append(' ').append(line);
        }
        step.out.toAll(playerRefs(combat.getRoomId()), new GameMessage(MessageType.ROUND_SUMMARY, sb.toString()));
    }

    // ========== Death ==========

    private void handleDeath(Combat combat, Combatant victim, String killerRef, Step step, List<String> notable) {
        String roomId = combat.getRoomId();
        String victimRef = victim.getRef();
        tickers.cancel(victimRef, "death");
        combat.removeParticipant(victimRef);
        fleeWindows.remove(victimRef);
        notable.add(victim.getName() + " falls.");

        if (victim instanceof InstanceCombatant ic) {
            CombatantInstance inst = ic.getInstance();
            registry.remove(victimRef);
            spawns.releaseSpawnSlot(inst);
            step.out.toAll(playerRefs(roomId), GameMessage.state(victim.getName() + " is slain!"));
            List<ItemInstance> drops = spawns.rollDeathLoot(inst, roomId, sessionResolver.apply(killerRef));
            if (!drops.isEmpty()) {
                List<String> names = new ArrayList<>();
                for (ItemInstance item : drops) {
                    names.add(item.getQuantity() > 1 ? item.getName() + " x" + item.getQuantity() : item.getName());
                }
                step.out.toAll(playerRefs(roomId), GameMessage.notice(victim.getName()
                        + " drops: " + String.join(", ", names) + "."));
            }
            logger.debug("[CombatManager] {} killed {} in {}", killerRef, victimRef, roomId);
        } else if (victim instanceof PlayerCombatant pc) {
            clearCombatPosition(victimRef);
            step.out.to(victimRef, MessageType.STATE, "You have been defeated!");
            step.out.toAllExcept(playerRefs(roomId), victimRef, GameMessage.state(victim.getName() + " is defeated!"));
            step.defeated.add(pc.getCharacter());
            logger.info("[CombatManager] {} was defeated in {}", victimRef, roomId);
        }

        for (CombatParticipant p : new ArrayList<>(combat.getParticipants())) {
            if (victimRef.equals(targetOf(p.getRef()))) {
                tickers.cancel(p.getRef(), "target died");
                retarget(combat, p, step);
            }
        }
    }

    // ========== Intents ==========

    /**
     * Start (or retarget) automatic attacks against a target.
     */
    public ActionOutcome attack(String actorRef, String targetRef) {
        return intent(actorRef, (roomId, step) -> {
            Combatant actor = combatant(actorRef);
            if (actor == null || !actor.isAlive()) {
                return ActionOutcome.notAllowed("You are in no state to fight.");
            }
            if (targetRef == null) {
                return ActionOutcome.invalidTarget("Attack whom?");
            }
            String problem = checkTarget(roomId, actor, targetRef);
            if (problem != null) {
                return ActionOutcome.invalidTarget(problem);
            }
            Combatant target = combatant(targetRef);
            if (!actor.isHostileTo(target)) {
                return ActionOutcome.notAllowed("You have no quarrel with " + target.getName() + ".");
            }
            if (isSafe(roomId)) {
                return ActionOutcome.notAllowed("This is a place of peace.");
            }
            return engageInternal(roomId, actor, target, step);
        });
    }

    /**
     * Commit a maneuver as this round's primary action.
     */
    public ActionOutcome useManeuver(String actorRef, String maneuverId, String targetRef) {
        return intent(actorRef, (roomId, step) -> {
            ManeuverDefinition m = content.getManeuver(maneuverId);
            if (m == null) {
                return ActionOutcome.notAllowed("There is no maneuver called '" + maneuverId + "'.");
            }
            if (m.isReaction()) {
                return ActionOutcome.notAllowed(m.name() + " is a reaction; ready it instead.");
            }
            Combatant actor = combatant(actorRef);
            if (actor == null || !actor.isAlive()) {
                return ActionOutcome.notAllowed("You are in no state to fight.");
            }
            if (!actor.knowsManeuver(m.id())) {
                return ActionOutcome.notAllowed("You don't know how to " + m.name() + ".");
            }
            Combat combat = activeCombat(roomId);
            CombatParticipant p = combat == null ? null : combat.getParticipant(actorRef);
            String tref = targetRef != null ? targetRef : targetOf(actorRef);
            if (tref == null) {
                return ActionOutcome.invalidTarget(m.name() + " whom?");
            }
            String problem = checkTarget(roomId, actor, tref);
            if (problem != null) {
                return ActionOutcome.invalidTarget(problem);
            }
            Combatant target = combatant(tref);
            if (!actor.isHostileTo(target)) {
                return ActionOutcome.notAllowed("You have no quarrel with " + target.getName() + ".");
            }
            if (isSafe(roomId)) {
                return ActionOutcome.notAllowed("This is a place of peace.");
            }
            RangeBand band = p != null ? bandOf(actorRef) : (combat != null ? RangeBand.FAR : RangeBand.ENGAGED);
            if (!(m.ranged() || actor.getAttack().ranged()) && band != RangeBand.ENGAGED) {
                return ActionOutcome.invalidTarget(target.getName() + " is out of reach.");
            }
            if (p != null && p.getState() == ParticipantState.DISENGAGING) {
                return ActionOutcome.notAllowed("You are trying to break away from the fight.");
            }
            if (p != null && p.hasPrimary()) {
                return ActionOutcome.notAllowed("You have already committed your action this round.");
            }
            if (!actor.spendStamina(m.staminaCost())) {
                return ActionOutcome.insufficientResource("You are too winded to " + m.name()
                        + " (needs " + m.staminaCost() + " stamina).");
            }
            if (p == null || p.getState() != ParticipantState.ENGAGED || !tref.equals(targetOf(actorRef))) {
                ActionOutcome engaged = engageInternal(roomId, actor, target, step);
                if (engaged.getStatus() != ActionOutcome.Status.ACCEPTED
                        && engaged.getStatus() != ActionOutcome.Status.NO_OP) {
                    actor.refundStamina(m.staminaCost());
                    return engaged;
                }
            }
            CombatParticipant participant = activeCombat(roomId).getParticipant(actorRef);
            participant.setPrimary(PendingAction.maneuver(m, tref));
            tickers.delay(actorRef, m.tickerDelayMillis());
            return ActionOutcome.accepted("You prepare to " + m.name() + " " + target.getName() + ".");
        });
    }

    /**
     * Try to break away from the fight. The check is rolled in this round's
     * action phase.
     */
    public ActionOutcome disengage(String actorRef) {
        return intent(actorRef, (roomId, step) -> {
            Combat combat = activeCombat(roomId);
            CombatParticipant p = combat == null ? null : combat.getParticipant(actorRef);
            if (p == null || p.getState() == ParticipantState.OBSERVING) {
                return ActionOutcome.noOp("You are not fighting anyone.");
            }
            if (p.getState() == ParticipantState.DISENGAGING) {
                return ActionOutcome.noOp("You are already trying to break away.");
            }
            if (p.getState() == ParticipantState.SUPPORTING) {
                p.setState(ParticipantState.OBSERVING);
                clearCombatPosition(actorRef);
                if (!hasHostilities(combat)) endCombat(combat, step);
                return ActionOutcome.accepted("You step back from the fight.");
            }
            if (p.isMovementBlocked()) {
                return ActionOutcome.notAllowed("You are pinned and cannot break away!");
            }
            if (p.hasPrimary()) {
                return ActionOutcome.notAllowed("You have already committed your action this round.");
            }
            p.beginDisengage(clock.nowMillis() + disengageTimeoutMillis, targetOf(actorRef));
            p.setPrimary(PendingAction.disengage());
            tickers.cancel(actorRef, "disengaging");
            Combatant actor = combatant(actorRef);
            step.out.toAllExcept(playerRefs(roomId), actorRef,
                    GameMessage.notice(actor.getName() + " looks for an opening to escape."));
            return ActionOutcome.accepted("You look for an opening to break away...");
        });
    }

    /**
     * Join the room's fight in a supporting role, at a distance.
     */
    public ActionOutcome joinCombat(String actorRef) {
        return intent(actorRef, (roomId, step) -> {
            Combat combat = activeCombat(roomId);
            if (combat == null) {
                return ActionOutcome.noOp("There is no fight here to join.");
            }
            CombatParticipant p = combat.getParticipant(actorRef);
            if (p != null && p.getState().isActive()) {
                return ActionOutcome.noOp("You are already part of the fight.");
            }
            if (p == null) {
                combat.addLateJoiner(actorRef, ParticipantState.SUPPORTING);
            } else {
                p.setState(ParticipantState.SUPPORTING);
            }
            fleeWindows.remove(actorRef);
            setBand(actorRef, RangeBand.FAR);
            Combatant actor = combatant(actorRef);
            step.out.toAllExcept(playerRefs(roomId), actorRef,
                    GameMessage.notice(actor.getName() + " joins the fight."));
            return ActionOutcome.accepted("You join the fight, hanging back for now.");
        });
    }

    /**
     * Spend the round's minor action.
     *
     * @param argument maneuver id for READY, free text for INTERACT
     */
    public ActionOutcome minorAction(String actorRef, MinorAction action, String argument) {
        return intent(actorRef, (roomId, step) -> {
            Combat combat = activeCombat(roomId);
            CombatParticipant p = combat == null ? null : combat.getParticipant(actorRef);
            if (p == null || !p.getState().isActive()) {
                return ActionOutcome.notAllowed("You are not in a fight.");
            }
            if (p.isMinorUsed()) {
                return ActionOutcome.notAllowed("You have already used your minor action this round.");
            }
            Combatant actor = combatant(actorRef);
            switch (action) {
                case ADVANCE: {
                    if (p.isMovementBlocked()) return ActionOutcome.notAllowed("You are pinned in place!");
                    RangeBand band = bandOf(actorRef);
                    if (band == RangeBand.ENGAGED) return ActionOutcome.noOp("You are already in the thick of it.");
                    RangeBand next = band.closer();
                    setBand(actorRef, next);
                    p.useMinor();
                    String target = targetOf(actorRef);
                    if (p.getState() == ParticipantState.ENGAGED && target != null
                            && inRange(actorRef, actor.getAttack().ranged())
                            && isValidOpponent(combat, roomId, actor, target) && !tickers.isTicking(actorRef)) {
                        tickers.start(actorRef, target, interval(actor));
                    }
                    return ActionOutcome.accepted("You move closer (" + next.getDisplayName() + ").");
                }
                case RETREAT: {
                    if (p.isMovementBlocked()) return ActionOutcome.notAllowed("You are pinned in place!");
                    RangeBand band = bandOf(actorRef);
                    if (band == RangeBand.FAR) return ActionOutcome.noOp("You are already at the edge of the fight.");
                    RangeBand next = band.farther();
                    setBand(actorRef, next);
                    p.useMinor();
                    if (!inRange(actorRef, actor.getAttack().ranged())) {
                        tickers.cancel(actorRef, "out of range");
                    }
                    return ActionOutcome.accepted("You fall back (" + next.getDisplayName() + ").");
                }
                case READY: {
                    ManeuverDefinition m = content.getManeuver(argument);
                    if (m == null || !m.isReaction()) {
                        return ActionOutcome.notAllowed("That is not a reaction you can ready.");
                    }
                    if (!actor.knowsManeuver(m.id())) {
                        return ActionOutcome.notAllowed("You don't know how to " + m.name() + ".");
                    }
                    p.setReadied(m);
                    p.useMinor();
                    return ActionOutcome.accepted("You ready " + m.name() + ".");
                }
                case INTERACT:
                default: {
                    p.useMinor();
                    String what = argument == null || argument.isBlank() ? "adjust your footing" : argument;
                    return ActionOutcome.accepted("You take a moment to " + what + ".");
                }
            }
        });
    }

    /**
     * Aggressive creatures in the room attack a player who just arrived.
     * @return number of creatures that attacked
     */
    public int provokeAggressors(String playerRef) {
        int[] count = {0};
        inActorRoom(playerRef, null, (roomId, step) -> {
            if (isSafe(roomId)) return null;
            Combatant player = combatant(playerRef);
            if (player == null || !player.isAlive()) return null;
            for (CombatantInstance inst : registry.combatantsInRoom(roomId)) {
                if (!inst.getBehavior().aggressive() || inst.isDead() || targetOf(inst.getRef()) != null) continue;
                Combatant creature = combatant(inst.getRef());
                if (creature == null || !creature.isHostileTo(player)) continue;
                step.out.to(playerRef, MessageType.STATE, creature.getName() + " snarls and attacks you!");
                engageInternal(roomId, creature, player, step);
                count[0]++;
            }
            return null;
        });
        return count[0];
    }

    /**
     * Take a disconnected combatant out of the fight. The session's ticker is
     * cancelled; the fight continues for everyone else.
     */
    public void onDisconnect(String ref) {
        inActorRoom(ref, null, (roomId, step) -> {
            tickers.cancel(ref, "disconnect");
            fleeWindows.remove(ref);
            Combat combat = activeCombat(roomId);
            CombatParticipant p = combat == null ? null : combat.getParticipant(ref);
            if (p == null) return null;
            p.clearDisengage();
            p.setPrimary(null);
            p.setState(ParticipantState.OBSERVING);
            clearCombatPosition(ref);
            for (CombatParticipant o : new ArrayList<>(combat.getParticipants())) {
                if (ref.equals(targetOf(o.getRef()))) {
                    tickers.cancel(o.getRef(), "target left");
                    retarget(combat, o, step);
                }
            }
            if (!hasHostilities(combat)) endCombat(combat, step);
            return null;
        });
    }

    // ========== Movement and pursuit (caller holds the room locks) ==========

    /**
     * Whether the combatant may walk out of its room right now.
     */
    public ActionOutcome checkDeparture(String ref) {
        String roomId = registry.roomOf(ref);
        Combat combat = roomId == null ? null : activeCombat(roomId);
        CombatParticipant p = combat == null ? null : combat.getParticipant(ref);
        if (p == null) {
            return ActionOutcome.accepted(null);
        }
        if (p.isMovementBlocked()) {
            return ActionOutcome.notAllowed("You are pinned in place!");
        }
        if (leaveMode == LeaveMode.LEAVE_ENDS_COMBAT) {
            return ActionOutcome.accepted(null);
        }
        if (p.getState() == ParticipantState.ENGAGED || p.getState() == ParticipantState.DISENGAGING) {
            return ActionOutcome.notAllowed("You are locked in combat! Disengage first.");
        }
        return ActionOutcome.accepted(null);
    }

    /**
     * Remove a departing combatant from its room's fight and work out who
     * follows it. Must be called with both rooms locked, before the move.
     *
     * @return creatures that will pursue into the destination
     */
    public List<CombatantInstance> departRoom(String ref, String fromRoomId, String toRoomId, Outbox out) {
        Step step = new Step();
        FleeWindow window = fleeWindows.remove(ref);
        Set<String> candidates = new LinkedHashSet<>();
        if (leaveMode == LeaveMode.DISENGAGE_AND_PURSUIT) {
            if (window != null && window.roomId().equals(fromRoomId)) {
                candidates.addAll(window.opponents());
            }
            for (CombatantInstance inst : registry.combatantsInRoom(fromRoomId)) {
                if (ref.equals(targetOf(inst.getRef()))) candidates.add(inst.getRef());
            }
        }
        removeFromCombat(activeCombat(fromRoomId), ref, step);

        Room from = content.getRoom(fromRoomId);
        Room to = content.getRoom(toRoomId);
        List<CombatantInstance> followers = new ArrayList<>();
        if (from != null && to != null) {
            long now = clock.nowMillis();
            for (String cand : candidates) {
                CombatantInstance inst = registry.getCombatantInstance(cand);
                if (inst == null || !fromRoomId.equals(registry.roomOf(cand))) continue;
                PursuitResolver.Decision decision = pursuitResolver.evaluate(inst, from, to, now);
                switch (decision.verdict()) {
                    case FOLLOWS -> followers.add(inst);
                    case RETURNS_HOME -> scheduler.scheduleAfter("return-" + cand, () -> returnHome(cand), 0);
                    default -> logger.debug("[CombatManager] {} does not pursue {}: {}", cand, ref, decision.reason());
                }
            }
        }
        mergeInto(step, out);
        return followers;
    }

    /**
     * Move a pursuing creature after its quarry and start the fight in the
     * destination. Must be called with both rooms locked, after the quarry moved.
     */
    public void pursue(CombatantInstance pursuer, String quarryRef, String fromRoomId, String toRoomId, Outbox out) {
        Step step = new Step();
        removeFromCombat(activeCombat(fromRoomId), pursuer.getRef(), step);
        registry.move(pursuer.getRef(), toRoomId);
        long now = clock.nowMillis();
        if (toRoomId.equals(pursuer.getOriginRoomId())) {
            pursuer.clearPursuit();
        } else {
            boolean first = !pursuer.isPursuing();
            pursuer.notePursuitStep(now);
            if (first) {
                long leash = pursuer.getBehavior().leashSeconds() * 1000L;
                String ref = pursuer.getRef();
                scheduler.scheduleAfter("leash-" + ref, () -> checkLeash(ref), leash + 1);
            }
        }
        step.out.toAll(playerRefs(fromRoomId), GameMessage.notice(pursuer.getName() + " gives chase!"));
        Combatant chaser = combatant(pursuer.getRef());
        Combatant quarry = combatant(quarryRef);
        if (quarry != null && quarry.isAlive() && toRoomId.equals(registry.roomOf(quarryRef))) {
            step.out.to(quarryRef, MessageType.STATE, pursuer.getName() + " follows you!");
            engageInternal(toRoomId, chaser, quarry, step);
        }
        mergeInto(step, out);
    }

    private void checkLeash(String ref) {
        CombatantInstance inst = registry.getCombatantInstance(ref);
        if (inst != null && PursuitResolver.leashExpired(inst, clock.nowMillis())) {
            returnHome(ref);
        }
    }

    /**
     * Send a creature back to its origin room, out of any fight.
     */
    public void returnHome(String ref) {
        CombatantInstance inst = registry.getCombatantInstance(ref);
        if (inst == null) return;
        String current = registry.roomOf(ref);
        String origin = inst.getOriginRoomId();
        if (current == null || origin == null || current.equals(origin) || content.getRoom(origin) == null) {
            inst.clearPursuit();
            return;
        }
        Step step = new Step();
        locks.withRooms(List.of(current, origin), () -> {
            if (!current.equals(registry.roomOf(ref))) return null;
            removeFromCombat(activeCombat(current), ref, step);
            registry.move(ref, origin);
            inst.clearPursuit();
            step.out.toAll(playerRefs(current), GameMessage.notice(inst.getName() + " breaks off and slinks away."));
            logger.debug("[CombatManager] {} returned to {}", ref, origin);
            return null;
        });
        flush(step);
    }

    // ========== Session lifecycle ==========

    private Combat ensureCombat(String roomId, Combatant actor, Combatant target) {
        Combat combat = activeCombat(roomId);
        if (combat != null) {
            joinLate(combat, actor.getRef(), ParticipantState.ENGAGED);
            joinLate(combat, target.getRef(), ParticipantState.ENGAGED);
            return combat;
        }
        List<Combat.InitiativeRoll> rolls = List.of(
                new Combat.InitiativeRoll(actor, calculator.rollInitiative(actor)),
                new Combat.InitiativeRoll(target, calculator.rollInitiative(target)));
        combat = Combat.start(combatIdGenerator.getAndIncrement(), roomId, rolls, clock.nowMillis());
        for (String ref : combat.getInitiativeOrder()) {
            setBand(ref, RangeBand.ENGAGED);
        }
        combatsByRoom.put(roomId, combat);
        logger.info("[CombatManager] Combat {} started in {}: {}", combat.getCombatId(), roomId,
                combat.getInitiativeOrder());
        return combat;
    }

    private void joinLate(Combat combat, String ref, ParticipantState state) {
        if (combat.hasParticipant(ref)) {
            if (bandOf(ref) == null) setBand(ref, RangeBand.FAR);
            return;
        }
        combat.addLateJoiner(ref, state);
        setBand(ref, RangeBand.FAR);
    }

    /**
     * Put actor on target: create or join the session, set the target and
     * start, switch or keep the ticker. Caller holds the room lock and has
     * validated the target.
     */
    private ActionOutcome engageInternal(String roomId, Combatant actor, Combatant target, Step step) {
        String actorRef = actor.getRef();
        Combat existing = activeCombat(roomId);
        CombatParticipant before = existing == null ? null : existing.getParticipant(actorRef);
        if (before != null && before.getState() == ParticipantState.DISENGAGING) {
            return ActionOutcome.notAllowed("You are trying to break away from the fight.");
        }
        AttackTicker ticker = tickers.get(actorRef);
        if (ticker != null && target.getRef().equals(ticker.getTargetRef())) {
            return ActionOutcome.noOp("You are already attacking " + target.getName() + ".");
        }

        Combat combat = ensureCombat(roomId, actor, target);
        CombatParticipant p = combat.getParticipant(actorRef);
        p.setState(ParticipantState.ENGAGED);
        fleeWindows.remove(actorRef);
        setTarget(actorRef, target.getRef());
        provoke(combat, target, actor, step);

        String notice;
        if (ticker != null) {
            tickers.start(actorRef, target.getRef(), interval(actor));
            notice = "You turn your attention to " + target.getName() + ".";
        } else if (inRange(actorRef, actor.getAttack().ranged())) {
            tickers.start(actorRef, target.getRef(), interval(actor));
            notice = "You attack " + target.getName() + "!";
        } else {
            notice = "You move against " + target.getName() + ", but must close the distance first.";
        }
        step.out.toAllExcept(playerRefs(roomId), actorRef,
                GameMessage.state(actor.getName() + " attacks " + target.getName() + "!"));
        return ActionOutcome.accepted(notice);
    }

    /**
     * A combatant that is attacked joins in and fights back.
     */
    private void provoke(Combat combat, Combatant defender, Combatant attacker, Step step) {
        CombatParticipant dp = combat.getParticipant(defender.getRef());
        if (dp == null) return;
        dp.addThreat(attacker.getRef(), 0);
        if (dp.getState() == ParticipantState.OBSERVING || dp.getState() == ParticipantState.SUPPORTING) {
            dp.setState(ParticipantState.ENGAGED);
            fleeWindows.remove(defender.getRef());
            step.out.to(defender.getRef(), MessageType.STATE, attacker.getName() + " attacks you! You are engaged.");
        }
        if (dp.getState() != ParticipantState.ENGAGED) return;
        String current = targetOf(defender.getRef());
        if (current == null || !isValidOpponent(combat, combat.getRoomId(), defender, current)) {
            setTarget(defender.getRef(), attacker.getRef());
            if (inRange(defender.getRef(), defender.getAttack().ranged())) {
                tickers.start(defender.getRef(), attacker.getRef(), interval(defender));
            }
        }
    }

    /**
     * Point a participant at its best remaining opponent, or stand it down.
     */
    private void retarget(Combat combat, CombatParticipant p, Step step) {
        Combatant c = combatant(p.getRef());
        if (c == null) return;
        String roomId = combat.getRoomId();
        String next = chooseTarget(combat, roomId, c, p);
        if (next == null) {
            tickers.cancel(p.getRef(), "no target");
            setTarget(p.getRef(), null);
            if (p.getState() == ParticipantState.ENGAGED) {
                p.setState(ParticipantState.OBSERVING);
                step.out.to(p.getRef(), MessageType.STATE, "You have no one left to fight.");
            }
            return;
        }
        setTarget(p.getRef(), next);
        if (p.getState() != ParticipantState.ENGAGED) return;
        if (inRange(p.getRef(), c.getAttack().ranged())) {
            tickers.start(p.getRef(), next, interval(c));
        } else {
            tickers.cancel(p.getRef(), "out of range");
        }
    }

    /**
     * Creatures follow their threat profile; players prefer whoever is
     * attacking them. Falls back to the first valid opponent in action order.
     */
    private String chooseTarget(Combat combat, String roomId, Combatant c, CombatParticipant p) {
        if (!c.isPlayer()) {
            ThreatProfile profile = c.getBehavior().threat();
            String best = null;
            int bestThreat = -1;
            for (Map.Entry<String, Integer> e : p.getThreat().entrySet()) {
                if (!isValidOpponent(combat, roomId, c, e.getKey())) continue;
                if (profile == ThreatProfile.FIRST_STRIKE) return e.getKey();
                if (e.getValue() > bestThreat) {
                    best = e.getKey();
                    bestThreat = e.getValue();
                }
            }
            if (best != null) return best;
        } else {
            for (CombatParticipant o : combat.actionQueue()) {
                if (c.getRef().equals(targetOf(o.getRef())) && isValidOpponent(combat, roomId, c, o.getRef())) {
                    return o.getRef();
                }
            }
        }
        for (CombatParticipant o : combat.actionQueue()) {
            if (isValidOpponent(combat, roomId, c, o.getRef())) return o.getRef();
        }
        return null;
    }

    private boolean isValidOpponent(Combat combat, String roomId, Combatant c, String ref) {
        if (ref == null || ref.equals(c.getRef())) return false;
        CombatParticipant o = combat.getParticipant(ref);
        if (o == null || !o.getState().isActive()) return false;
        Combatant oc = combatant(ref);
        return oc != null && oc.isAlive() && c.isHostileTo(oc) && roomId.equals(registry.roomOf(ref));
    }

    private boolean hasHostilities(Combat combat) {
        Set<Integer> alliances = new HashSet<>();
        for (CombatParticipant p : combat.getParticipants()) {
            if (!p.getState().isActive()) continue;
            Combatant c = combatant(p.getRef());
            if (c != null && c.isAlive() && combat.getRoomId().equals(registry.roomOf(p.getRef()))) {
                alliances.add(c.getAlliance());
            }
        }
        return alliances.size() >= 2;
    }

    private void removeFromCombat(Combat combat, String ref, Step step) {
        tickers.cancel(ref, "left combat");
        if (registry.isLive(ref)) clearCombatPosition(ref);
        if (combat == null) return;
        if (combat.removeParticipant(ref) == null) return;
        for (CombatParticipant o : new ArrayList<>(combat.getParticipants())) {
            if (ref.equals(targetOf(o.getRef()))) {
                tickers.cancel(o.getRef(), "target left");
                retarget(combat, o, step);
            }
        }
        if (!hasHostilities(combat)) endCombat(combat, step);
    }

    private void endCombat(Combat combat, Step step) {
        combat.end();
        combatsByRoom.remove(combat.getRoomId(), combat);
        for (CombatParticipant p : combat.getParticipants()) {
            tickers.cancel(p.getRef(), "combat ended");
            if (registry.isLive(p.getRef())) clearCombatPosition(p.getRef());
        }
        step.out.toAll(playerRefs(combat.getRoomId()), GameMessage.state("The fighting here is over."));
        logger.info("[CombatManager] Combat {} in {} ended after {} rounds",
                combat.getCombatId(), combat.getRoomId(), combat.getCurrentRound());
    }

    // ========== Ticker fires ==========

    private boolean onTickerFire(AttackTicker ticker) {
        String ref = ticker.getOwnerRef();
        String roomId = registry.roomOf(ref);
        if (roomId == null) return false;
        Step step = new Step();
        boolean keep = locks.withRoom(roomId, () -> {
            if (!roomId.equals(registry.roomOf(ref))) return false;
            Combat combat = activeCombat(roomId);
            CombatParticipant p = combat == null ? null : combat.getParticipant(ref);
            if (p == null || p.getState() != ParticipantState.ENGAGED) return false;
            Combatant actor = combatant(ref);
            if (actor == null || !actor.isAlive()) return false;
            String target = ticker.getTargetRef();
            if (checkTarget(roomId, actor, target) != null || !inRange(ref, actor.getAttack().ranged())) {
                tickers.cancel(ref, "target invalid");
                step.out.to(ref, MessageType.NOTICE, "Your target is no longer within reach.");
                retarget(combat, p, step);
                return false;
            }
            p.addSwing();
            return true;
        });
        flush(step);
        return keep;
    }

    // ========== Helpers ==========

    @FunctionalInterface
    private interface RoomAction<T> {
        T apply(String roomId, Step step);
    }

    /**
     * Run an intent under the actor's room lock, re-checking the room once the
     * lock is held, then deliver its messages.
     */
    private <T> T inActorRoom(String actorRef, T missing, RoomAction<T> action) {
        String roomId = registry.roomOf(actorRef);
        if (roomId == null) {
            return missing;
        }
        Step step = new Step();
        T result = locks.withRoom(roomId, () -> {
            if (!roomId.equals(registry.roomOf(actorRef))) {
                return missing;
            }
            return action.apply(roomId, step);
        });
        flush(step);
        return result;
    }

    private ActionOutcome intent(String actorRef, RoomAction<ActionOutcome> action) {
        return inActorRoom(actorRef, ActionOutcome.invalidTarget("You are not where you thought you were."), action);
    }

    private void flush(Step step) {
        if (!step.out.isEmpty()) {
            messageDispatcher.accept(step.out);
        }
        for (PlayerCharacter pc : step.defeated) {
            try {
                defeatHandler.accept(pc);
            } catch (RuntimeException e) {
                logger.error("[CombatManager] Defeat handling failed for {}", pc.getRef(), e);
            }
        }
    }

    private void mergeInto(Step step, Outbox out) {
        for (Outbox.Envelope e : step.out.drain()) {
            out.to(e.recipientRef(), e.message());
        }
        for (PlayerCharacter pc : step.defeated) {
            defeatHandler.accept(pc);
        }
    }

    /**
     * Why a target is not attackable, or null if it is.
     */
    private String checkTarget(String roomId, Combatant actor, String targetRef) {
        if (targetRef == null) return "You have no target.";
        if (targetRef.equals(actor.getRef())) return "You can't attack yourself.";
        EntityPosition pos = registry.positionOf(targetRef);
        if (pos == null) return "Your target is gone.";
        if (!roomId.equals(pos.roomId())) return "Your target is not here.";
        Combatant target = combatant(targetRef);
        if (target == null) return "You can't fight that.";
        if (!target.isAlive()) return target.getName() + " is already dead.";
        return null;
    }

    private Combatant combatant(String ref) {
        return Combatant.lookup(registry, ref);
    }

    private Combat activeCombat(String roomId) {
        Combat combat = combatsByRoom.get(roomId);
        return combat != null && combat.isActive() ? combat : null;
    }

    private boolean isSafe(String roomId) {
        Room room = content.getRoom(roomId);
        return room != null && room.hasFlag(RoomFlag.SAFE);
    }

    private long interval(Combatant c) {
        return c.getAttack().intervalMillis(baseIntervalSeconds);
    }

    private int effectiveAccuracy(Combatant c, CombatParticipant p, boolean rangedAttack, String roomId) {
        int acc = c.getAccuracy() + (p == null ? 0 : p.accuracyModifier());
        if (rangedAttack && weather != null) {
            Room room = content.getRoom(roomId);
            if (room != null) {
                acc += weather.rangedAccuracyModifier(room.getRegionId(), room.getExposure(), bandOf(c.getRef()));
            }
        }
        return acc;
    }

    private static int effectiveAvoidance(Combatant c, CombatParticipant p) {
        return c.getAvoidance() + (p == null ? 0 : p.avoidanceModifier());
    }

    private RangeBand bandOf(String ref) {
        EntityPosition pos = registry.positionOf(ref);
        return pos == null || pos.band() == null ? RangeBand.FAR : pos.band();
    }

    private boolean inRange(String ref, boolean ranged) {
        return ranged || bandOf(ref) == RangeBand.ENGAGED;
    }

    private String targetOf(String ref) {
        EntityPosition pos = registry.positionOf(ref);
        return pos == null ? null : pos.targetRef();
    }

    private void setTarget(String ref, String targetRef) {
        EntityPosition pos = registry.positionOf(ref);
        if (pos != null) registry.setPosition(pos.withTarget(targetRef));
    }

    private void setBand(String ref, RangeBand band) {
        EntityPosition pos = registry.positionOf(ref);
        if (pos != null) registry.setPosition(pos.withBand(band));
    }

    private void clearCombatPosition(String ref) {
        EntityPosition pos = registry.positionOf(ref);
        if (pos != null) registry.setPosition(pos.clearCombat());
    }

    private List<String> playerRefs(String roomId) {
        List<String> refs = new ArrayList<>();
        for (PlayerCharacter pc : registry.playersInRoom(roomId)) {
            refs.add(pc.getRef());
        }
        return refs;
    }

    // ========== Queries ==========

    public Combat getCombatInRoom(String roomId) {
        return activeCombat(roomId);
    }

    public Collection<Combat> getAllActiveCombats() {
        return Collections.unmodifiableCollection(combatsByRoom.values());
    }

    public int getActiveCombatCount() {
        return combatsByRoom.size();
    }

    /**
     * Participant state of a combatant in its current room, or null outside any fight.
     */
    public ParticipantState getState(String ref) {
        String roomId = registry.roomOf(ref);
        Combat combat = roomId == null ? null : activeCombat(roomId);
        CombatParticipant p = combat == null ? null : combat.getParticipant(ref);
        return p == null ? null : p.getState();
    }

    /**
     * Whether the combatant is an active (non-observing) participant.
     */
    public boolean isInCombat(String ref) {
        ParticipantState state = getState(ref);
        return state != null && state.isActive();
    }

    public FleeWindow getFleeWindow(String ref) {
        return fleeWindows.get(ref);
    }

    public AttackTickerService getTickers() {
        return tickers;
    }

    public LeaveMode getLeaveMode() {
        return leaveMode;
    }

    public void shutdown() {
        tickers.shutdown();
        combatsByRoom.clear();
        fleeWindows.clear();
        logger.info("[CombatManager] Shutdown");
    }
}
