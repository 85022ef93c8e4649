package com.github.nlayna.transferengine.model;

import lombok.Data;

@Data
public class PriorityUpdate {
    private TransferPriority priority;
}
