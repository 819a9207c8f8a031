package icu.wwj.benchmark.rmdb.protocol;

import io.vertx.core.Future;

/**
 * Statement template bound to a session.
 */
public final class Statement {
    
    private final RMDBSession session;
    
    private final String template;
    
    Statement(RMDBSession session, String template) {
        this.session = session;
        this.template = template;
    }
    
    public Future<QueryResult> execute(Object... params) {
        return session.execute(template, params);
    }
}
