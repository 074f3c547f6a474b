package com.example.apirecovery.queue;

// 声明顺序即优先级从低到高
public enum RequestPriority {
    LOW, NORMAL, HIGH, CRITICAL
}
