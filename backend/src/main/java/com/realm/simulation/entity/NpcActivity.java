package com.realm.simulation.entity;

/**
 * NPC活动状态
 */
public enum NpcActivity {

    IDLE,

    WORKING,

    TRAVELING,

    EATING,

    SLEEPING,

    SOCIALIZING
}
