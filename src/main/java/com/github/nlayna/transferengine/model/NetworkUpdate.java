package com.github.nlayna.transferengine.model;

import lombok.Data;

@Data
public class NetworkUpdate {
    private NetworkClass networkClass;
}
