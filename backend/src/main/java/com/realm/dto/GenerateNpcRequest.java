package com.realm.dto;

import lombok.Data;

import java.util.List;

/**
 * NPC生成请求
 * professions 不传表示随机职业，传空数组表示平民
 */
@Data
public class GenerateNpcRequest {

    private List<String> professions;

    private String race;

    private String faction;
}
