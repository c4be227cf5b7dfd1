package com.clawd.core.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One (provider, model) entry of a tier's preference list.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProviderTarget {

    private String provider;
    private String model;

    @Override
    public String toString() {
        return provider + "/" + model;
    }
}
