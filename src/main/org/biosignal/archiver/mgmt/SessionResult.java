package org.biosignal.archiver.mgmt;

import java.util.List;

import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ArchiverResult;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.config.SessionInfo;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Outcome of session lookups and changes; carries one session or a list of sessions.
 */
public class SessionResult extends ArchiverResult {
	private final SessionInfo session;
	private final List<SessionInfo> sessions;

	private SessionResult(ResultCode code, String message, SessionInfo session, List<SessionInfo> sessions) {
		super(code, message);
		this.session = session;
		this.sessions = sessions;
	}

	public static SessionResult of(SessionInfo session, String message) {
		return new SessionResult(ResultCode.OK, message, session, null);
	}

	public static SessionResult of(List<SessionInfo> sessions) {
		return new SessionResult(ResultCode.OK, sessions.size() + " sessions", null, sessions);
	}

	public static SessionResult failure(ArchiverException ex) {
		return new SessionResult(ex.getCode(), ex.getMessage(), null, null);
	}

	public static SessionResult failure(ResultCode code, String message) {
		return new SessionResult(code, message, null, null);
	}

	public SessionInfo getSession() {
		return session;
	}

	public List<SessionInfo> getSessions() {
		return sessions;
	}

	@SuppressWarnings("unchecked")
	@Override
	protected void addFields(JSONObject ret) {
		if(session != null) {
			ret.put("session", session.toJSON());
		}
		if(sessions != null) {
			JSONArray sessionsArray = new JSONArray();
			for(SessionInfo info : sessions) {
				sessionsArray.add(info.toJSON());
			}
			ret.put("sessions", sessionsArray);
		}
	}
}
