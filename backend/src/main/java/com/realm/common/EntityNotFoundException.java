package com.realm.common;

/**
 * 世界中不存在指定ID的地点或NPC
 */
public class EntityNotFoundException extends RealmException {

    public EntityNotFoundException(String kind, String id) {
        super(kind + " 不存在: " + id, "ENTITY_NOT_FOUND");
    }
}
