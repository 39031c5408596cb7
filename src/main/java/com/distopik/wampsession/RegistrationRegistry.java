package com.distopik.wampsession;

import java.util.HashMap;
import java.util.Map;

/**
 * Registered procedures keyed by registration id and by name, plus the invocations
 * that have been dispatched to them and not answered yet. An invocation id stays
 * pending until its reply is sent, no matter in which order other invocations finish.
 * Not thread safe, the owning session serializes access.
 */
public class RegistrationRegistry {
	private final Map<Long, Registration>   byId          = new HashMap<>();
	private final Map<String, Registration> byProcedure   = new HashMap<>();
	private final Map<Long, Registration>   invocations   = new HashMap<>();

	public void insert(Registration registration) {
		if (byProcedure.containsKey(registration.getProcedure()))
			throw new DuplicateRegistrationException(registration.getProcedure());
		byId.put(registration.getId(), registration);
		byProcedure.put(registration.getProcedure(), registration);
	}

	public Registration remove(long registrationId) {
		Registration registration = byId.remove(registrationId);
		if (registration != null)
			byProcedure.remove(registration.getProcedure());
		return registration;
	}

	public Registration get(long registrationId) {
		return byId.get(registrationId);
	}

	public boolean contains(String procedure) {
		return byProcedure.containsKey(procedure);
	}

	public int size() {
		return byId.size();
	}

	/** Marks an invocation as outstanding; false if the id is already outstanding. */
	public boolean beginInvocation(long invocationId, Registration registration) {
		if (invocations.containsKey(invocationId))
			return false;
		invocations.put(invocationId, registration);
		return true;
	}

	/** Ends an outstanding invocation; false if it was already answered, interrupted or cleared. */
	public boolean endInvocation(long invocationId) {
		return invocations.remove(invocationId) != null;
	}

	public int pendingInvocations() {
		return invocations.size();
	}

	public void clear() {
		byId.clear();
		byProcedure.clear();
		invocations.clear();
	}
}
