package com.solo.content;

/**
 * Описание предмета из каталога кампании.
 * Экземпляры в инвентаре являются отдельными объектами, поэтому два одинаковых шлема различимы.
 */
public class ItemDefinition {
    private String id;
    private String name;
    private ItemKind kind = ItemKind.UNKNOWN;
    private EquipmentSlot slot;
    private ItemEffect effect;
    private boolean countsTowardLimit = true;

    private ItemDefinition() {
    }

    public ItemDefinition(String id, String name, ItemKind kind, EquipmentSlot slot,
                          ItemEffect effect, boolean countsTowardLimit) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.slot = slot;
        this.effect = effect;
        this.countsTowardLimit = countsTowardLimit;
    }

    /**
     * Синтетический предмет для неизвестного id или имени
     */
    public static ItemDefinition unknown(String name) {
        return new ItemDefinition("unknown", name, ItemKind.UNKNOWN, null, null, true);
    }

    public ItemDefinition copy() {
        return new ItemDefinition(id, name, kind, slot, effect, countsTowardLimit);
    }

    public int getArmorBonus() {
        if (effect == null || effect.getType() != EffectType.AC) {
            return 0;
        }
        return effect.getBonus();
    }

    public String getId() { return id != null ? id : "unknown"; }
    public String getName() { return name != null ? name : "Unknown Item"; }
    public ItemKind getKind() { return kind != null ? kind : ItemKind.UNKNOWN; }
    public EquipmentSlot getSlot() { return slot; }
    public ItemEffect getEffect() { return effect; }
    public boolean isCountsTowardLimit() { return countsTowardLimit; }

    @Override
    public String toString() {
        return getName();
    }
}
