package org.carball.pgsight.monitor;

@FunctionalInterface
public interface QueryEventListener {

    void onQuery(QueryEvent event);
}
