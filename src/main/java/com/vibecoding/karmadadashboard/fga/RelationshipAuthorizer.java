package com.vibecoding.karmadadashboard.fga;

/**
 * (user, relation, object) 관계 튜플 기반 인가
 * - user 는 사용자 이름, object 는 objectType:objectId 로 전송된다
 */
public interface RelationshipAuthorizer {

    String TYPE_DASHBOARD = "dashboard";
    String TYPE_CLUSTER = "cluster";
    String DASHBOARD_ID = "dashboard";

    String RELATION_ADMIN = "admin";
    String RELATION_BASIC_USER = "basic_user";
    String RELATION_OWNER = "owner";
    String RELATION_MEMBER = "member";

    boolean check(String user, String relation, String objectType, String objectId);

    void writeTuple(String user, String relation, String objectType, String objectId);

    void deleteTuple(String user, String relation, String objectType, String objectId);
}
