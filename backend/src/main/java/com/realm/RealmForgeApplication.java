package com.realm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 幻想内容生成与世界模拟系统主应用类
 *
 * @version 1.0.0
 */
@SpringBootApplication
public class RealmForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealmForgeApplication.class, args);
        System.out.println("🚀 RealmForge 启动成功");
        System.out.println("🗺️ 生成接口: http://localhost:8080/api/generate");
        System.out.println("⏳ 模拟接口: http://localhost:8080/api/world");
    }
}
