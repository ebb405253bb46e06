package com.assetbridge.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Registry of the engine's background services. Reports a global status line and stops everything on shutdown.
 */
public class ServiceManager {
    private static ServiceManager instance;
    private final List<BackgroundService> registeredServices = new CopyOnWriteArrayList<>();

    public ServiceManager() {
    }

    public static synchronized ServiceManager getInstance() {
        if (instance == null) {
            instance = new ServiceManager();
        }
        return instance;
    }

    public void registerService(BackgroundService service) {
        if (!registeredServices.contains(service)) {
            registeredServices.add(service);
        }
    }

    public void unregisterService(BackgroundService service) {
        registeredServices.remove(service);
    }

    /**
     * @return "Idle" when nothing runs, otherwise the comma separated statuses of running services.
     */
    public String getGlobalStatus() {
        List<String> activeTasks = new ArrayList<>();
        for (BackgroundService service : registeredServices) {
            if (service.isRunning()) {
                activeTasks.add(service.getStatus());
            }
        }
        if (activeTasks.isEmpty()) {
            return "Idle";
        }
        return String.join(", ", activeTasks);
    }

    public List<BackgroundService> getActiveServices() {
        return registeredServices.stream()
                .filter(BackgroundService::isRunning)
                .collect(Collectors.toList());
    }

    public List<BackgroundService> getRegisteredServices() {
        return new ArrayList<>(registeredServices);
    }

    /**
     * Checks if a service of the given type is currently running.
     */
    public boolean isServiceRunning(Class<? extends BackgroundService> serviceClass) {
        return registeredServices.stream()
                .anyMatch(s -> serviceClass.isInstance(s) && s.isRunning());
    }

    /**
     * Stops all running services of the given type.
     */
    public void stopService(Class<? extends BackgroundService> serviceClass) {
        List<BackgroundService> servicesToStop = registeredServices.stream()
                .filter(s -> serviceClass.isInstance(s) && s.isRunning())
                .collect(Collectors.toList());
        for (BackgroundService service : servicesToStop) {
            service.stopService();
        }
    }

    /**
     * Stops all registered services and clears the registry.
     */
    public void shutdown() {
        for (BackgroundService service : registeredServices) {
            service.stopService();
        }
        registeredServices.clear();
    }
}
