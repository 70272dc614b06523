package org.biosignal.archiver.config.persistence;

import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.config.SessionStatus;
import org.biosignal.archiver.utils.simulation.SimulatedBatches;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class InMemoryPersistenceTest {

	@Test
	public void testValuesAreCopied() throws Exception {
		InMemoryPersistence persistence = new InMemoryPersistence();
		SessionInfo session = SimulatedBatches.newSession("inmemory");
		Assertions.assertTrue(persistence.addSession(session));
		session.markAsError("changed after add");
		Assertions.assertEquals(SessionStatus.ACTIVE, persistence.getSession(session.getSessionId()).getStatus());

		SessionInfo fetched = persistence.getSession(session.getSessionId());
		fetched.addSamples(10);
		Assertions.assertEquals(0, persistence.getSession(session.getSessionId()).getTotalSamples());

		persistence.putSession(fetched);
		Assertions.assertEquals(10, persistence.getSession(session.getSessionId()).getTotalSamples());
		Assertions.assertFalse(persistence.addSession(session));
	}
}
