package com.github.nlayna.transferengine.model;

public enum NetworkRequirement {
    ANY,
    UNMETERED_ONLY,
    LOCAL_ONLY;

    public boolean isSatisfiedBy(NetworkClass networkClass) {
        if (networkClass == null || networkClass == NetworkClass.OFFLINE) {
            return false;
        }
        return switch (this) {
            case ANY -> true;
            case UNMETERED_ONLY -> networkClass == NetworkClass.UNMETERED || networkClass == NetworkClass.LOCAL;
            case LOCAL_ONLY -> networkClass == NetworkClass.LOCAL;
        };
    }
}
