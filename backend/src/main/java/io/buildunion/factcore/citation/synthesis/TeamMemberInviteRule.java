package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.member.InvitationStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * One TEAM_MEMBER_INVITE per roster member (keyed by user id) and per pending invitation (keyed by
 * {@code invite:<email>}).
 */
final class TeamMemberInviteRule implements SynthesisRule {

  static final String INVITE_PREFIX = "invite:";

  @Override
  public String name() {
    return "team-member-invite";
  }

  @Override
  public List<Citation> candidates(LedgerSnapshot snapshot, SynthesisContext context) {
    var citations = new ArrayList<Citation>();
    for (var member : context.members()) {
      String memberId = member.getUserId().toString();
      var metadata = new LinkedHashMap<String, Object>();
      metadata.put("member_id", memberId);
      metadata.put("role", member.getRole());
      metadata.put("status", "active");
      if (member.getName() != null) {
        metadata.put("name", member.getName());
      }
      if (member.getEmail() != null) {
        metadata.put("email", member.getEmail());
      }
      String display = member.getName() != null ? member.getName() : member.getEmail();
      citations.add(
          SyntheticCitations.create(
              CiteType.TEAM_MEMBER_INVITE,
              memberId,
              (display != null ? display : memberId) + " (" + member.getRole() + ")",
              memberId,
              metadata,
              context.now()));
    }
    for (var invitation : context.invitations()) {
      if (invitation.getStatus() != InvitationStatus.PENDING) {
        continue;
      }
      String email = invitation.getEmail().trim().toLowerCase(Locale.ROOT);
      String key = INVITE_PREFIX + email;
      var metadata = new LinkedHashMap<String, Object>();
      metadata.put("member_id", key);
      metadata.put("email", email);
      metadata.put("role", invitation.getRole());
      metadata.put("status", "pending");
      citations.add(
          SyntheticCitations.create(
              CiteType.TEAM_MEMBER_INVITE,
              key,
              email + " (" + invitation.getRole() + ", invited)",
              email,
              metadata,
              context.now()));
    }
    return citations;
  }
}
