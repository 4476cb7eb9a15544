package io.buildunion.factcore.access;

/** Project-level role names as stored on the roster. */
public final class ProjectRoles {

  public static final String OWNER = "owner";
  public static final String FOREMAN = "foreman";
  public static final String WORKER = "worker";
  public static final String INSPECTOR = "inspector";
  public static final String SUBCONTRACTOR = "subcontractor";
  public static final String MEMBER = "member";

  private ProjectRoles() {}
}
