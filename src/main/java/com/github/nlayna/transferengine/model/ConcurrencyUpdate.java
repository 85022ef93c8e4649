package com.github.nlayna.transferengine.model;

import lombok.Data;

@Data
public class ConcurrencyUpdate {
    private Integer maxConcurrentTasks;
}
