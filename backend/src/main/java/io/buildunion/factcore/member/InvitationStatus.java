package io.buildunion.factcore.member;

public enum InvitationStatus {
  PENDING,
  ACCEPTED,
  DECLINED
}
