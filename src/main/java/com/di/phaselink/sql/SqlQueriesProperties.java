package com.di.phaselink.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (phaselink.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "phaselink.sql")
public class SqlQueriesProperties {

    private Usage usage = new Usage();
    private ExecutionLog executionLog = new ExecutionLog();
    private DeadLetter deadLetter = new DeadLetter();
    private Roster roster = new Roster();

    public Usage getUsage() { return usage; }
    public void setUsage(Usage usage) { this.usage = usage; }
    public ExecutionLog getExecutionLog() { return executionLog; }
    public void setExecutionLog(ExecutionLog executionLog) { this.executionLog = executionLog; }
    public DeadLetter getDeadLetter() { return deadLetter; }
    public void setDeadLetter(DeadLetter deadLetter) { this.deadLetter = deadLetter; }
    public Roster getRoster() { return roster; }
    public void setRoster(Roster roster) { this.roster = roster; }

    public static class Usage {
        private String upsertLatest;
        private String insertHistory;
        private String findOne;
        private String findByStage;
        private String findHistory;
        public String getUpsertLatest() { return upsertLatest; }
        public void setUpsertLatest(String upsertLatest) { this.upsertLatest = upsertLatest; }
        public String getInsertHistory() { return insertHistory; }
        public void setInsertHistory(String insertHistory) { this.insertHistory = insertHistory; }
        public String getFindOne() { return findOne; }
        public void setFindOne(String findOne) { this.findOne = findOne; }
        public String getFindByStage() { return findByStage; }
        public void setFindByStage(String findByStage) { this.findByStage = findByStage; }
        public String getFindHistory() { return findHistory; }
        public void setFindHistory(String findHistory) { this.findHistory = findHistory; }
    }

    public static class ExecutionLog {
        private String insert;
        private String findByInvocationId;
        private String findRecent;
        private String findRecentByStage;
        private String findLastSuccess;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindByInvocationId() { return findByInvocationId; }
        public void setFindByInvocationId(String findByInvocationId) { this.findByInvocationId = findByInvocationId; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
        public String getFindRecentByStage() { return findRecentByStage; }
        public void setFindRecentByStage(String findRecentByStage) { this.findRecentByStage = findRecentByStage; }
        public String getFindLastSuccess() { return findLastSuccess; }
        public void setFindLastSuccess(String findLastSuccess) { this.findLastSuccess = findLastSuccess; }
    }

    public static class DeadLetter {
        private String insert;
        private String findById;
        private String findByStatus;
        private String countByStatus;
        private String findOldestPending;
        private String updateStatus;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getFindByStatus() { return findByStatus; }
        public void setFindByStatus(String findByStatus) { this.findByStatus = findByStatus; }
        public String getCountByStatus() { return countByStatus; }
        public void setCountByStatus(String countByStatus) { this.countByStatus = countByStatus; }
        public String getFindOldestPending() { return findOldestPending; }
        public void setFindOldestPending(String findOldestPending) { this.findOldestPending = findOldestPending; }
        public String getUpdateStatus() { return updateStatus; }
        public void setUpdateStatus(String updateStatus) { this.updateStatus = updateStatus; }
    }

    public static class Roster {
        private String findActiveOn;
        public String getFindActiveOn() { return findActiveOn; }
        public void setFindActiveOn(String findActiveOn) { this.findActiveOn = findActiveOn; }
    }
}
