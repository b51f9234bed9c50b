package io.cardfederation.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the local card catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocalCard {
    private String id;
    private String name;
}
