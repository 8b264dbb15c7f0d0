package com.example.anchormud.world;

import com.example.anchormud.combat.ActionOutcome;
import com.example.anchormud.combat.CombatManager;
import com.example.anchormud.combat.MinorAction;
import com.example.anchormud.combat.ParticipantState;
import com.example.anchormud.event.EncounterService;
import com.example.anchormud.event.EventScheduler;
import com.example.anchormud.event.ExpirySweeper;
import com.example.anchormud.event.SpawnService;
import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.Direction;
import com.example.anchormud.model.EntityInstance;
import com.example.anchormud.model.ItemInstance;
import com.example.anchormud.model.ManeuverDefinition;
import com.example.anchormud.model.NpcInstance;
import com.example.anchormud.model.NpcTemplate;
import com.example.anchormud.model.PlayerCharacter;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.StoreHours;
import com.example.anchormud.model.Weather;
import com.example.anchormud.net.GameMessage;
import com.example.anchormud.net.MessageSink;
import com.example.anchormud.net.MessageType;
import com.example.anchormud.net.Outbox;
import com.example.anchormud.net.Session;
import com.example.anchormud.net.SessionRegistry;
import com.example.anchormud.persistence.AccountValidator;
import com.example.anchormud.persistence.CharacterSheetStore;
import com.example.anchormud.persistence.DeferredWriteQueue;
import com.example.anchormud.persistence.PersistenceException;
import com.example.anchormud.persistence.SettingsStore;
import com.example.anchormud.persistence.WorldContent;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.GameConfig;
import com.example.anchormud.util.NpcScheduleService;
import com.example.anchormud.util.StoreHoursService;
import com.example.anchormud.util.TickService;
import com.example.anchormud.util.WeatherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * The runtime core as seen by the command layer: wires the clock, registry,
 * room states, spawn engine, combat engine, weather and schedules together and
 * exposes the intent surface.
 *
 * Intents return an {@link ActionOutcome} whose notice the caller shows to the
 * actor. Everything else a session should see arrives through its
 * {@link MessageSink}.
 */
public class WorldRuntime {
    private static final Logger logger = LoggerFactory.getLogger(WorldRuntime.class);

    static final String CLOCK_SETTING = "world.seconds";
    private static final long SCHEDULE_PERIOD_MILLIS = GameClock.MILLIS_PER_MINUTE;

    private final GameConfig config;
    private final GameClock clock;
    private final WorldContent content;
    private final CharacterSheetStore sheets;      // may be null
    private final AccountValidator accounts;       // may be null
    private final SettingsStore settings;          // may be null

    private final EntityRegistry registry = new EntityRegistry();
    private final RoomLockManager locks = new RoomLockManager();
    private final SessionRegistry sessions = new SessionRegistry();
    private final RoomStateManager rooms;
    private final EventScheduler scheduler;
    private final DeferredWriteQueue writes;
    private final SpawnService spawns;
    private final EncounterService encounters;
    private final ExpirySweeper sweeper;
    private final WeatherService weather;
    private final NpcScheduleService npcSchedules;
    private final StoreHoursService storeHours;
    private final CombatManager combat;
    private final String respawnRoomId;

    private TickService tickService;

    public WorldRuntime(GameConfig config, GameClock clock, WorldContent content, CharacterSheetStore sheets,
                        AccountValidator accounts, SettingsStore settings, Random rng) {
        this.config = config;
        this.clock = clock;
        this.content = content;
        this.sheets = sheets;
        this.accounts = accounts;
        this.settings = settings;
        Random random = rng == null ? new Random() : rng;

        this.rooms = new RoomStateManager(clock, registry, config.roomIdleHorizonMillis(), config.roomResetMillis());
        this.scheduler = new EventScheduler(clock);
        this.writes = new DeferredWriteQueue(config.retryAttempts(), config.retryBackoffMillis());
        this.spawns = new SpawnService(clock, registry, rooms, locks, content,
                config.itemExpiryMillis(), config.lootReservationMillis());
        this.encounters = new EncounterService(clock, rooms, locks, content, spawns, random,
                config.encounterRollChance(), config.encounterCooldownMillis(), config.encounterLifetimeMillis());
        this.sweeper = new ExpirySweeper(clock, registry, rooms, locks, spawns);
        this.weather = new WeatherService(clock, null, random, settings, writes);
        this.npcSchedules = new NpcScheduleService(clock);
        this.storeHours = new StoreHoursService(clock);
        this.combat = new CombatManager(clock, registry, locks, content, weather, spawns, scheduler, config, random);

        String respawn = config.respawnRoom();
        if (content.getRoom(respawn) == null) {
            respawn = content.getRooms().isEmpty() ? null : content.getRooms().iterator().next().getId();
            logger.warn("[WorldRuntime] Respawn room '{}' not found, using {}", config.respawnRoom(), respawn);
        }
        this.respawnRoomId = respawn;

        combat.setMessageDispatcher(sessions::deliver);
        combat.setSessionResolver(sessions::sessionIdFor);
        combat.setDefeatHandler(this::handleDefeat);
        sweeper.setEngagedCheck(combat::isInCombat);
        weather.setChangeListener(this::announceWeather);
        for (NpcTemplate npc : content.getNpcTemplates()) {
            npcSchedules.register(npc);
        }
        for (StoreHours hours : content.getStoreHours()) {
            storeHours.register(hours);
        }
        restoreWorldState();
    }

    // ========== Lifecycle ==========

    private void restoreWorldState() {
        if (settings != null) {
            try {
                String saved = settings.get(CLOCK_SETTING);
                if (saved != null) {
                    clock.restore(Long.parseLong(saved.trim()));
                    logger.info("[WorldRuntime] Restored world clock: {}", clock.timeString());
                }
            } catch (PersistenceException e) {
                logger.warn("[WorldRuntime] Could not restore world clock: {}", e.getMessage());
            } catch (NumberFormatException e) {
                logger.warn("[WorldRuntime] Ignoring malformed world clock setting: {}", e.getMessage());
            }
        }
        Set<String> regions = new TreeSet<>();
        for (Room room : content.getRooms()) {
            if (room.getRegionId() != null) regions.add(room.getRegionId());
        }
        weather.restore(regions);
    }

    /**
     * Start background processing: the event scheduler, combat pulse, expiry
     * sweep, and the per-minute schedule, weather and clock-save tasks.
     */
    public synchronized void start() {
        if (tickService != null) return;
        tickService = new TickService();
        scheduler.initialize(tickService, config.pulseMillis());
        combat.initialize(tickService);
        scheduleBackgroundTasks();
        logger.info("[WorldRuntime] Started at {} with {} rooms", clock.timeString(), content.getRooms().size());
    }

    /**
     * Register the recurring world tasks on the event scheduler without
     * starting threads. {@link #start()} calls this; tests drive
     * {@link #pulse()} by hand instead.
     */
    public void scheduleBackgroundTasks() {
        sweeper.initialize(scheduler, config.sweepMillis());
        scheduler.scheduleRecurring("npc-schedules", this::syncAllNpcs, 0, SCHEDULE_PERIOD_MILLIS);
        scheduler.scheduleRecurring("weather", this::updateOccupiedRegions, SCHEDULE_PERIOD_MILLIS, SCHEDULE_PERIOD_MILLIS);
        scheduler.scheduleRecurring("clock-save", this::saveClock, SCHEDULE_PERIOD_MILLIS, SCHEDULE_PERIOD_MILLIS);
    }

    /**
     * Run one pulse on the calling thread: due scheduled events, then the combat pulse.
     */
    public void pulse() {
        scheduler.processDue();
        combat.tick();
    }

    public synchronized void shutdown() {
        logger.info("[WorldRuntime] Shutting down");
        for (PlayerCharacter pc : new ArrayList<>(registry.allPlayers())) {
            saveSheet(pc);
        }
        saveClock();
        if (tickService != null) {
            tickService.shutdown();
            tickService = null;
        }
        combat.shutdown();
        scheduler.shutdown();
        writes.shutdown(5000);
    }

    private void saveClock() {
        if (settings == null) return;
        String value = Long.toString(clock.worldSeconds());
        writes.submit("world clock", () -> settings.put(CLOCK_SETTING, value));
    }

    private void saveSheet(PlayerCharacter pc) {
        if (sheets == null || pc == null) return;
        String room = registry.roomOf(pc.getRef());
        if (room != null) pc.setSavedRoomId(room);
        writes.submit("sheet " + pc.getName(), () -> sheets.save(pc));
    }

    // ========== Sessions ==========

    /**
     * Attach a session to a character. Validates the account, loads the sheet
     * (or creates a fresh character) and places it in the world. A character
     * still in the world from a dropped connection is simply reattached.
     */
    public ActionOutcome connect(String name, String credential, MessageSink sink) {
        if (name == null || !name.matches("[A-Za-z][A-Za-z0-9_]{1,19}")) {
            return ActionOutcome.notAllowed("That is not a valid name.");
        }
        if (accounts != null) {
            try {
                if (!accounts.validate(name, credential)) {
                    return ActionOutcome.notAllowed("Invalid name or password.");
                }
            } catch (PersistenceException e) {
                logger.warn("[WorldRuntime] Account check failed for {}: {}", name, e.getMessage());
                return ActionOutcome.notAllowed("The harbormaster's ledgers are unavailable. Try again shortly.");
            }
        }
        String ref = PlayerCharacter.refFor(name);
        PlayerCharacter existing = registry.getPlayer(ref);
        if (existing != null) {
            sessions.open(ref, sink, clock.nowMillis());
            sessions.send(ref, new GameMessage(MessageType.ROOM, renderRoom(registry.roomOf(ref), ref)));
            logger.info("[WorldRuntime] {} reconnected", name);
            return ActionOutcome.accepted("Welcome back, " + existing.getName() + ".");
        }

        PlayerCharacter pc;
        try {
            pc = loadOrCreate(name);
        } catch (PersistenceException e) {
            logger.warn("[WorldRuntime] Could not load sheet for {}: {}", name, e.getMessage());
            return ActionOutcome.notAllowed("Your character sheet could not be loaded. Try again shortly.");
        }
        String roomId = pc.getSavedRoomId() != null && content.getRoom(pc.getSavedRoomId()) != null
                ? pc.getSavedRoomId() : respawnRoomId;
        if (roomId == null) {
            return ActionOutcome.notAllowed("The world has no rooms.");
        }
        sessions.open(ref, sink, clock.nowMillis());
        Outbox out = new Outbox();
        locks.runInRoom(roomId, () -> {
            registry.placePlayer(pc, roomId);
            out.toAllExcept(playerRefs(roomId), ref, new GameMessage(MessageType.PRESENCE, pc.getName() + " arrives."));
        });
        sessions.deliver(out);
        logger.info("[WorldRuntime] {} entered the world in {}", pc.getName(), roomId);
        enterRoom(ref, roomId);
        return ActionOutcome.accepted("Welcome to the Black Anchor, " + pc.getName() + ".");
    }

    private PlayerCharacter loadOrCreate(String name) throws PersistenceException {
        if (sheets != null) {
            Optional<PlayerCharacter> loaded = sheets.load(name);
            if (loaded.isPresent()) return loaded.get();
        }
        PlayerCharacter pc = new PlayerCharacter(name, 30, 20, 55, 45, 0);
        for (ManeuverDefinition m : content.getManeuvers()) {
            pc.learnManeuver(m.id());
        }
        pc.setSavedRoomId(respawnRoomId);
        logger.info("[WorldRuntime] Created new character {}", name);
        return pc;
    }

    /**
     * Detach a session. The character stops fighting at once and leaves the
     * world once the grace period passes without a reconnect.
     */
    public void disconnect(String playerRef) {
        Session session = sessions.markDisconnected(playerRef, clock.nowMillis());
        if (session == null) return;
        combat.onDisconnect(playerRef);
        saveSheet(registry.getPlayer(playerRef));
        scheduler.scheduleAfter("grace-" + playerRef, () -> finishDisconnect(session), config.disconnectGraceMillis());
        logger.info("[WorldRuntime] {} disconnected; removal in {}ms", playerRef, config.disconnectGraceMillis());
    }

    private void finishDisconnect(Session session) {
        if (session.isConnected() || sessions.get(session.getPlayerRef()) != session) return;
        String ref = session.getPlayerRef();
        String roomId = registry.roomOf(ref);
        PlayerCharacter pc = registry.getPlayer(ref);
        if (pc != null) saveSheet(pc);
        sessions.remove(session);
        if (roomId == null) {
            registry.removePlayer(ref);
            return;
        }
        Outbox out = new Outbox();
        locks.runInRoom(roomId, () -> {
            registry.removePlayer(ref);
            if (pc != null) {
                out.toAll(playerRefs(roomId), new GameMessage(MessageType.PRESENCE, pc.getName() + " fades from view."));
            }
        });
        sessions.deliver(out);
        logger.info("[WorldRuntime] Removed {} after grace period", ref);
    }

    // ========== Intents ==========

    public ActionOutcome attack(String actorRef, String targetWord) {
        String target = resolveTarget(actorRef, targetWord);
        if (targetWord != null && target == null) {
            return ActionOutcome.invalidTarget("You don't see '" + targetWord + "' here.");
        }
        return combat.attack(actorRef, target);
    }

    public ActionOutcome useManeuver(String actorRef, String maneuverId, String targetWord) {
        String target = null;
        if (targetWord != null && !targetWord.isBlank()) {
            target = resolveTarget(actorRef, targetWord);
            if (target == null) {
                return ActionOutcome.invalidTarget("You don't see '" + targetWord + "' here.");
            }
        }
        return combat.useManeuver(actorRef, maneuverId, target);
    }

    public ActionOutcome disengage(String actorRef) {
        return combat.disengage(actorRef);
    }

    public ActionOutcome joinCombat(String actorRef) {
        return combat.joinCombat(actorRef);
    }

    public ActionOutcome minorAction(String actorRef, MinorAction action, String argument) {
        return combat.minorAction(actorRef, action, argument);
    }

    /**
     * Strike up a conversation with an NPC. The NPC stays put for the length
     * of the talk hold, and any schedule move it owes is applied once the
     * hold lapses.
     */
    public ActionOutcome talk(String actorRef, String npcWord) {
        String roomId = registry.roomOf(actorRef);
        if (roomId == null) {
            return ActionOutcome.invalidTarget("You are nowhere.");
        }
        if (npcWord == null || npcWord.isBlank()) {
            return ActionOutcome.invalidTarget("Talk to whom?");
        }
        NpcInstance npc = null;
        for (CombatantInstance inst : registry.combatantsInRoom(roomId)) {
            if (inst instanceof NpcInstance candidate && !candidate.isDead()
                    && candidate.getTemplate().matchesKeyword(npcWord)) {
                npc = candidate;
                break;
            }
        }
        if (npc == null) {
            return ActionOutcome.invalidTarget("There is nobody called '" + npcWord + "' to talk to here.");
        }
        if (combat.isInCombat(npc.getRef())) {
            return ActionOutcome.notAllowed(npc.getName() + " is too busy fighting to talk.");
        }
        long until = clock.nowMillis() + config.talkHoldMillis();
        npc.holdUntil(until);
        String npcId = npc.getTemplateId();
        scheduler.scheduleAt("talk-" + npc.getRef(), () -> syncNpc(npcId), until + 1);
        logger.debug("[WorldRuntime] {} holding {} until {}", actorRef, npc.getRef(), until);

        Object greeting = npc.getTemplate().getExtensions().get("greeting");
        String said = greeting == null ? npc.getName() + " nods at you."
                : npc.getName() + " says, \"" + greeting + "\"";
        return ActionOutcome.accepted(said);
    }

    /**
     * Walk through an exit. Combat rules decide whether the actor may leave;
     * pursuing creatures follow in the same step.
     */
    public ActionOutcome move(String actorRef, Direction dir) {
        String from = registry.roomOf(actorRef);
        if (from == null) {
            return ActionOutcome.invalidTarget("You are nowhere.");
        }
        Room room = content.getRoom(from);
        String to = room == null || dir == null ? null : room.getExit(dir);
        if (to == null || content.getRoom(to) == null) {
            return ActionOutcome.notAllowed("You can't go that way.");
        }
        Outbox out = new Outbox();
        ActionOutcome result = locks.withRooms(List.of(from, to), () -> {
            if (!from.equals(registry.roomOf(actorRef))) {
                return ActionOutcome.invalidTarget("You are not where you thought you were.");
            }
            ActionOutcome check = combat.checkDeparture(actorRef);
            if (!check.isAccepted()) return check;
            String name = displayName(actorRef);
            List<CombatantInstance> followers = combat.departRoom(actorRef, from, to, out);
            registry.move(actorRef, to);
            out.toAllExcept(playerRefs(from), actorRef,
                    new GameMessage(MessageType.PRESENCE, name + " leaves " + dir.getName() + "."));
            out.toAllExcept(playerRefs(to), actorRef,
                    new GameMessage(MessageType.PRESENCE, name + " arrives from the " + dir.opposite().getName() + "."));
            for (CombatantInstance follower : followers) {
                combat.pursue(follower, actorRef, from, to, out);
            }
            return ActionOutcome.accepted(null);
        });
        sessions.deliver(out);
        if (result.isAccepted()) {
            enterRoom(actorRef, to);
        }
        return result;
    }

    /**
     * Pick up an item from the floor. Reserved loot can only be taken by the
     * session it is reserved for until the reservation lapses.
     */
    public ActionOutcome pickUp(String actorRef, String itemWord) {
        String roomId = registry.roomOf(actorRef);
        PlayerCharacter pc = registry.getPlayer(actorRef);
        if (roomId == null || pc == null) {
            return ActionOutcome.invalidTarget("You are nowhere.");
        }
        if (itemWord == null || itemWord.isBlank()) {
            return ActionOutcome.invalidTarget("Get what?");
        }
        String sessionId = sessions.sessionIdFor(actorRef);
        ActionOutcome result = locks.withRoom(roomId, () -> {
            ItemInstance item = null;
            for (ItemInstance candidate : registry.itemsInRoom(roomId)) {
                if (candidate.getTemplate().matchesKeyword(itemWord)) {
                    item = candidate;
                    break;
                }
            }
            if (item == null) {
                return ActionOutcome.invalidTarget("You don't see '" + itemWord + "' here.");
            }
            if (!item.canBeTakenBy(sessionId, clock.nowMillis())) {
                return ActionOutcome.notAllowed(item.getName() + " is claimed by someone else for now.");
            }
            registry.remove(item.getRef());
            spawns.releaseLootSlot(item);
            pc.addToInventory(item.getTemplateId(), item.getQuantity());
            String label = item.getQuantity() > 1 ? item.getName() + " x" + item.getQuantity() : item.getName();
            return ActionOutcome.accepted("You pick up " + label + ".");
        });
        if (result.isAccepted()) {
            saveSheet(pc);
        }
        return result;
    }

    /**
     * Read-only description of a room for one viewer.
     */
    public String renderRoom(String roomId, String viewerRef) {
        Room room = roomId == null ? null : content.getRoom(roomId);
        if (room == null) {
            return "You are floating in the void.";
        }
        weather.maybeUpdate(room.getRegionId());
        StringBuilder sb = new StringBuilder();
        sb.append(room.getName()).append('\n');
        sb.append(room.getDescription()).append('\n');
        String overlay = weather.overlay(room.getRegionId(), room.getExposure());
        if (overlay != null) {
            sb.append(overlay).append('\n');
        }
        if (room.getExposure() != null && room.getExposure().isAffected()) {
            sb.append(clock.timeString()).append('\n');
        }
        List<String> exits = new ArrayList<>();
        for (Direction d : Direction.values()) {
            if (room.getExit(d) != null) exits.add(d.getName());
        }
        sb.append("Exits: ").append(exits.isEmpty() ? "none" : String.join(" ", exits));
        if (storeHours.hasHours(roomId)) {
            StoreHours hours = storeHours.getHours(roomId);
            sb.append('\n').append("Hours: ").append(hours.openTime()).append('-').append(hours.closeTime())
                    .append(" (").append(storeHours.status(roomId)).append(')');
        }

        for (EntityInstance inst : registry.instancesInRoom(roomId)) {
            sb.append('\n');
            if (inst instanceof ItemInstance item) {
                sb.append(item.getQuantity() > 1 ? item.getName() + " (x" + item.getQuantity() + ")" : item.getName())
                        .append(" lies here.");
            } else {
                sb.append(inst.getName()).append(" is here");
                String target = registry.positionOf(inst.getRef()) == null ? null
                        : registry.positionOf(inst.getRef()).targetRef();
                if (target != null) {
                    sb.append(target.equals(viewerRef) ? ", fighting you" : ", fighting " + displayName(target));
                }
                sb.append('.');
            }
        }
        for (PlayerCharacter other : registry.playersInRoom(roomId)) {
            if (other.getRef().equals(viewerRef)) continue;
            sb.append('\n').append(other.getName()).append(" is here");
            ParticipantState state = combat.getState(other.getRef());
            if (state != null && state.isActive()) {
                sb.append(", ").append(state.getDisplayName());
            }
            sb.append('.');
        }
        return sb.toString();
    }

    /**
     * Find a combatant in the actor's room by keyword or player name.
     * @return its ref, or null
     */
    public String resolveTarget(String actorRef, String word) {
        if (word == null || word.isBlank()) return null;
        String roomId = registry.roomOf(actorRef);
        if (roomId == null) return null;
        for (CombatantInstance inst : registry.combatantsInRoom(roomId)) {
            if (!inst.isDead() && inst.getTemplate().matchesKeyword(word)) return inst.getRef();
        }
        String lower = word.trim().toLowerCase();
        for (PlayerCharacter pc : registry.playersInRoom(roomId)) {
            if (!pc.getRef().equals(actorRef) && pc.getName().toLowerCase().startsWith(lower)) return pc.getRef();
        }
        return null;
    }

    // ========== Room entry ==========

    /**
     * Everything that happens when a player arrives: expired things go, the
     * room may reset, spawn rules and encounter tables are evaluated, scheduled
     * NPCs are synced, aggressive creatures attack and the room is shown.
     */
    void enterRoom(String playerRef, String roomId) {
        sweeper.sweepRoom(roomId);
        locks.runInRoom(roomId, () -> rooms.maybeReset(roomId));
        List<EntityInstance> spawned = spawns.evaluateRoom(roomId);
        List<CombatantInstance> encountered = encounters.maybeRollEncounter(roomId);
        for (String npcId : npcSchedules.candidatesFor(roomId)) {
            syncNpc(npcId);
        }
        for (CombatantInstance inst : encountered) {
            sessions.send(playerRef, GameMessage.notice(inst.getName() + " emerges from the shadows!"));
        }
        if (!spawned.isEmpty()) {
            logger.debug("[WorldRuntime] {} spawned {} instances in {}", playerRef, spawned.size(), roomId);
        }
        sessions.send(playerRef, new GameMessage(MessageType.ROOM, renderRoom(roomId, playerRef)));
        combat.provokeAggressors(playerRef);
    }

    // ========== NPC schedules ==========

    private void syncAllNpcs() {
        for (String npcId : npcSchedules.getNpcIds()) {
            try {
                syncNpc(npcId);
            } catch (RuntimeException e) {
                logger.error("[WorldRuntime] Failed to sync NPC {}", npcId, e);
            }
        }
    }

    /**
     * Put a scheduled NPC where its schedule says, unless it is busy.
     */
    void syncNpc(String npcId) {
        NpcInstance npc = registry.findNpc(npcId);
        String current = npc == null ? null : registry.roomOf(npc.getRef());
        String busy = null;
        if (npc != null) {
            if (combat.isInCombat(npc.getRef())) busy = "in combat";
            else if (npc.isBusy(clock.nowMillis())) busy = "busy";
        }
        String target = npcSchedules.resolve(npcId, current, busy);
        if (target != null && content.getRoom(target) == null) {
            logger.warn("[WorldRuntime] NPC {} scheduled into unknown room {}", npcId, target);
            return;
        }
        if (target == null ? current == null : target.equals(current)) return;

        List<String> involved = new ArrayList<>();
        if (current != null) involved.add(current);
        if (target != null) involved.add(target);
        Outbox out = new Outbox();
        locks.withRooms(involved, () -> {
            NpcInstance live = registry.findNpc(npcId);
            String now = live == null ? null : registry.roomOf(live.getRef());
            if (now == null ? current != null : !now.equals(current)) return null;
            if (live == null) {
                NpcInstance created = (NpcInstance) spawns.createCombatant(npcId, target, null, null, 0);
                out.toAll(playerRefs(target), new GameMessage(MessageType.PRESENCE, created.getName() + " arrives."));
            } else if (target == null) {
                registry.remove(live.getRef());
                out.toAll(playerRefs(current), new GameMessage(MessageType.PRESENCE, live.getName() + " heads off."));
            } else {
                registry.move(live.getRef(), target);
                out.toAll(playerRefs(current), new GameMessage(MessageType.PRESENCE, live.getName() + " heads off."));
                out.toAll(playerRefs(target), new GameMessage(MessageType.PRESENCE, live.getName() + " arrives."));
            }
            return null;
        });
        sessions.deliver(out);
        logger.debug("[WorldRuntime] NPC {} {} -> {}", npcId, current, target);
    }

    // ========== Weather ==========

    private void updateOccupiedRegions() {
        Set<String> regions = new HashSet<>();
        for (String roomId : registry.occupiedRooms()) {
            Room room = content.getRoom(roomId);
            if (room != null && room.getRegionId() != null && registry.hasPlayers(roomId)) {
                regions.add(room.getRegionId());
            }
        }
        for (String region : regions) {
            weather.maybeUpdate(region);
        }
    }

    private void announceWeather(String regionId, Weather now) {
        for (PlayerCharacter pc : registry.allPlayers()) {
            Room room = content.getRoom(registry.roomOf(pc.getRef()));
            if (room != null && regionId.equals(room.getRegionId())
                    && room.getExposure() != null && room.getExposure().isAffected()) {
                sessions.send(pc.getRef(), new GameMessage(MessageType.WEATHER, now.getChangeMessage()));
            }
        }
    }

    // ========== Defeat ==========

    /**
     * A defeated player wakes in the respawn room with half health.
     */
    private void handleDefeat(PlayerCharacter pc) {
        String ref = pc.getRef();
        String from = registry.roomOf(ref);
        if (from == null || respawnRoomId == null) return;
        Outbox out = new Outbox();
        locks.withRooms(List.of(from, respawnRoomId), () -> {
            registry.move(ref, respawnRoomId);
            pc.setHp(Math.max(1, pc.getMaxHp() / 2));
            out.toAllExcept(playerRefs(respawnRoomId), ref,
                    new GameMessage(MessageType.PRESENCE, pc.getName() + " is carried in, battered but breathing."));
            return null;
        });
        out.to(ref, MessageType.STATE, "You come to in " + content.getRoom(respawnRoomId).getName() + ", aching all over.");
        sessions.deliver(out);
        saveSheet(pc);
        sessions.send(ref, new GameMessage(MessageType.ROOM, renderRoom(respawnRoomId, ref)));
        logger.info("[WorldRuntime] {} respawned in {}", ref, respawnRoomId);
    }

    // ========== Helpers ==========

    private List<String> playerRefs(String roomId) {
        List<String> refs = new ArrayList<>();
        for (PlayerCharacter pc : registry.playersInRoom(roomId)) {
            refs.add(pc.getRef());
        }
        return refs;
    }

    private String displayName(String ref) {
        PlayerCharacter pc = registry.getPlayer(ref);
        if (pc != null) return pc.getName();
        EntityInstance inst = registry.getInstance(ref);
        return inst == null ? "someone" : inst.getName();
    }

    // ========== Accessors ==========

    public GameClock getClock() { return clock; }
    public WorldContent getContent() { return content; }
    public EntityRegistry getRegistry() { return registry; }
    public RoomLockManager getLocks() { return locks; }
    public RoomStateManager getRooms() { return rooms; }
    public SessionRegistry getSessions() { return sessions; }
    public EventScheduler getScheduler() { return scheduler; }
    public SpawnService getSpawns() { return spawns; }
    public WeatherService getWeather() { return weather; }
    public NpcScheduleService getNpcSchedules() { return npcSchedules; }
    public StoreHoursService getStoreHours() { return storeHours; }
    public CombatManager getCombat() { return combat; }
    public DeferredWriteQueue getWrites() { return writes; }
    public String getRespawnRoomId() { return respawnRoomId; }
}
