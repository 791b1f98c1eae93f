package io.github.manjago.snakeescape.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Color-keyed wiring of a level, built once per load.
 * <ul>
 *   <li>Portals are paired by color: exactly two endpoints link, a lone one stays inert.</li>
 *   <li>Plates, lift gates and laser gates are grouped by color.</li>
 * </ul>
 */
public class LinkRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(LinkRegistry.class);
    
    private final Map<GroupColor, List<PressurePlate>> platesByColor = new EnumMap<>(GroupColor.class);
    private final Map<GroupColor, List<LiftGate>> liftGatesByColor = new EnumMap<>(GroupColor.class);
    private final Map<GroupColor, List<LaserGate>> laserGatesByColor = new EnumMap<>(GroupColor.class);
    private final List<Portal> portals = new ArrayList<>();
    
    private LinkRegistry() {
    }
    
    /**
     * Group and pair every wired entity of a level.
     * 
     * @param store the level's entity arena
     * @return the registry
     * @throws IllegalStateException if a portal color has more than two endpoints
     */
    public static LinkRegistry build(EntityStore store) {
        LinkRegistry registry = new LinkRegistry();
        
        for (PressurePlate plate : store.ofType(PressurePlate.class)) {
            registry.platesByColor.computeIfAbsent(plate.getColor(), c -> new ArrayList<>()).add(plate);
        }
        for (LiftGate gate : store.ofType(LiftGate.class)) {
            registry.liftGatesByColor.computeIfAbsent(gate.getColor(), c -> new ArrayList<>()).add(gate);
        }
        for (LaserGate gate : store.ofType(LaserGate.class)) {
            registry.laserGatesByColor.computeIfAbsent(gate.getColor(), c -> new ArrayList<>()).add(gate);
        }
        
        registry.portals.addAll(store.ofType(Portal.class));
        registry.linkPortals();
        
        for (GroupColor color : registry.getGroupColors()) {
            if (registry.getPlates(color).isEmpty()) {
                log.warn("Gate group {} has no pressure plates; its gates never change", color);
            }
        }
        
        log.debug("Link registry built: {} plates, {} lift gates, {} laser gates, {} portals",
                registry.platesByColor.values().stream().mapToInt(List::size).sum(),
                registry.liftGatesByColor.values().stream().mapToInt(List::size).sum(),
                registry.laserGatesByColor.values().stream().mapToInt(List::size).sum(),
                registry.portals.size());
        return registry;
    }
    
    private void linkPortals() {
        Map<PortalColor, List<Portal>> byColor = new EnumMap<>(PortalColor.class);
        for (Portal portal : portals) {
            byColor.computeIfAbsent(portal.getColor(), c -> new ArrayList<>()).add(portal);
        }
        
        for (Map.Entry<PortalColor, List<Portal>> entry : byColor.entrySet()) {
            List<Portal> group = entry.getValue();
            if (group.size() > 2) {
                throw new IllegalStateException(String.format(
                        "Portal color %s has %d endpoints, at most 2 allowed", entry.getKey(), group.size()));
            }
            if (group.size() == 2) {
                Portal.link(group.get(0), group.get(1));
            } else {
                log.warn("Portal {} at {} has no partner and stays inert",
                        entry.getKey(), group.get(0).getPosition());
            }
        }
    }
    
    // ========== Queries ==========
    
    public List<PressurePlate> getPlates(GroupColor color) {
        return Collections.unmodifiableList(platesByColor.getOrDefault(color, List.of()));
    }
    
    public List<LiftGate> getLiftGates(GroupColor color) {
        return Collections.unmodifiableList(liftGatesByColor.getOrDefault(color, List.of()));
    }
    
    public List<LaserGate> getLaserGates(GroupColor color) {
        return Collections.unmodifiableList(laserGatesByColor.getOrDefault(color, List.of()));
    }
    
    public List<PressurePlate> getAllPlates() {
        List<PressurePlate> all = new ArrayList<>();
        platesByColor.values().forEach(all::addAll);
        return all;
    }
    
    public List<Portal> getPortals() {
        return Collections.unmodifiableList(portals);
    }
    
    /**
     * Every color that has at least one plate or gate, in enum order.
     */
    public Set<GroupColor> getGroupColors() {
        Set<GroupColor> colors = EnumSet.noneOf(GroupColor.class);
        colors.addAll(platesByColor.keySet());
        colors.addAll(liftGatesByColor.keySet());
        colors.addAll(laserGatesByColor.keySet());
        return colors;
    }
    
    /**
     * True when the color group has plates and every one of them is pressed.
     * A group without plates is never fully active.
     */
    public boolean isGroupActive(GroupColor color) {
        List<PressurePlate> plates = getPlates(color);
        if (plates.isEmpty()) {
            return false;
        }
        for (PressurePlate plate : plates) {
            if (!plate.isActive()) {
                return false;
            }
        }
        return true;
    }
}
