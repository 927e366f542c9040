package com.ryuqq.machine.testkit.contract;

import com.ryuqq.machine.application.actuator.Verb;
import com.ryuqq.machine.core.exception.ReconcileException;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.model.MachineSpec;
import com.ryuqq.machine.core.model.MachineStatus;
import com.ryuqq.machine.core.scope.MachineScope;
import com.ryuqq.machine.core.spi.MachineReconciler;
import com.ryuqq.machine.core.spi.MachineStore;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable reconciler backed by a fake provider.
 *
 * <p>The fake provider is a set of provisioned instance names. The reconciler behaves the
 * way a well-written provider reconciler should: it is idempotent and treats a machine
 * already in the desired state as success, touching the scope only when something changed.</p>
 *
 * <p><strong>Verb Behaviour:</strong></p>
 * <ul>
 *   <li>create: provisions the instance if missing, then records providerId, RUNNING state and address</li>
 *   <li>update: mirrors providerSpec into providerStatus</li>
 *   <li>delete: releases the instance and removes the machine from the store</li>
 *   <li>exists: reports provider presence and records the observed state on the working copy</li>
 * </ul>
 *
 * <p><strong>Scripting:</strong> {@link #failOn(Verb, RuntimeException)} makes a verb throw,
 * {@link #beforeVerb(Verb, Consumer)} runs a hook before the verb's own logic.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedReconciler implements MachineReconciler {

    public static final String RUNNING = "RUNNING";
    public static final String ABSENT = "ABSENT";

    private final MachineStore store;
    private final Set<MachineName> instances = ConcurrentHashMap.newKeySet();
    private final Map<Verb, RuntimeException> failures = new EnumMap<>(Verb.class);
    private final Map<Verb, Consumer<MachineScope>> hooks = new EnumMap<>(Verb.class);
    private final Map<Verb, AtomicInteger> invocations = new EnumMap<>(Verb.class);
    private final AtomicInteger provisionCount = new AtomicInteger();

    /**
     * @param store store the delete verb removes machines from
     */
    public ScriptedReconciler(MachineStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
        for (Verb verb : Verb.values()) {
            invocations.put(verb, new AtomicInteger());
        }
    }

    @Override
    public void create(MachineScope scope) {
        enter(Verb.CREATE, scope);
        MachineName name = scope.name();
        if (instances.add(name)) {
            provisionCount.incrementAndGet();
        }

        String providerId = providerIdOf(name);
        if (!providerId.equals(scope.spec().providerId())) {
            scope.setSpec(scope.spec().withProviderId(providerId));
        }
        MachineStatus running = scope.status()
            .withInstanceState(RUNNING)
            .withAddresses(List.of(addressOf(name)));
        if (!running.equals(scope.status())) {
            scope.setStatus(running);
        }
    }

    @Override
    public void update(MachineScope scope) {
        enter(Verb.UPDATE, scope);
        if (!instances.contains(scope.name())) {
            throw new ReconcileException("instance for machine " + scope.name() + " not found at provider");
        }
        MachineSpec spec = scope.spec();
        MachineStatus status = scope.status();
        if (!spec.providerSpec().equals(status.providerStatus())) {
            scope.setStatus(new MachineStatus(spec.providerSpec(), status.addresses(), status.instanceState()));
        }
    }

    @Override
    public void delete(MachineScope scope) {
        enter(Verb.DELETE, scope);
        instances.remove(scope.name());
        store.delete(scope.name());
    }

    @Override
    public boolean exists(MachineScope scope) {
        enter(Verb.EXISTS, scope);
        boolean exists = instances.contains(scope.name());
        String observed = exists ? RUNNING : ABSENT;
        if (!observed.equals(scope.status().instanceState())) {
            scope.setStatus(scope.status().withInstanceState(observed));
        }
        return exists;
    }

    /**
     * Makes the verb throw the failure on every call until cleared.
     *
     * @param verb the verb
     * @param failure the failure to throw
     * @return this reconciler
     */
    public ScriptedReconciler failOn(Verb verb, RuntimeException failure) {
        synchronized (failures) {
            failures.put(verb, failure);
        }
        return this;
    }

    /**
     * Runs the hook before the verb's own logic on every call.
     *
     * @param verb the verb
     * @param hook the hook
     * @return this reconciler
     */
    public ScriptedReconciler beforeVerb(Verb verb, Consumer<MachineScope> hook) {
        synchronized (hooks) {
            hooks.put(verb, hook);
        }
        return this;
    }

    /**
     * Registers an instance at the fake provider without going through create.
     *
     * @param name the machine name
     */
    public void provision(MachineName name) {
        instances.add(name);
    }

    public boolean hasInstance(MachineName name) {
        return instances.contains(name);
    }

    public int invocations(Verb verb) {
        return invocations.get(verb).get();
    }

    public int getProvisionCount() {
        return provisionCount.get();
    }

    /**
     * Clears failures, hooks, counters and provider instances.
     */
    public void reset() {
        synchronized (failures) {
            failures.clear();
        }
        synchronized (hooks) {
            hooks.clear();
        }
        invocations.values().forEach(counter -> counter.set(0));
        instances.clear();
        provisionCount.set(0);
    }

    public static String providerIdOf(MachineName name) {
        return "fake://" + name.getValue();
    }

    public static String addressOf(MachineName name) {
        return name.getValue() + ".internal";
    }

    private void enter(Verb verb, MachineScope scope) {
        invocations.get(verb).incrementAndGet();
        Consumer<MachineScope> hook;
        RuntimeException failure;
        synchronized (hooks) {
            hook = hooks.get(verb);
        }
        synchronized (failures) {
            failure = failures.get(verb);
        }
        if (hook != null) {
            hook.accept(scope);
        }
        if (failure != null) {
            throw failure;
        }
    }
}
