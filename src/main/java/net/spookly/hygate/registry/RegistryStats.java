package net.spookly.hygate.registry;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class RegistryStats {
    int totalServices;
    int totalInstances;
    int healthyInstances;
    int unhealthyInstances;
    int unknownInstances;
    int totalRoutes;
    double averageHealthCheckMs;
}
