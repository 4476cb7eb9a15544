package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.contract.Contract;
import io.buildunion.factcore.member.TeamInvitation;
import io.buildunion.factcore.member.TeamMember;
import io.buildunion.factcore.task.Task;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Related project data the synthesis rules derive citations from. */
public record SynthesisContext(
    UUID projectId,
    String projectTrade,
    String projectAddress,
    List<Task> tasks,
    List<TeamMember> members,
    List<TeamInvitation> invitations,
    BigDecimal financialTotal,
    List<Contract> contracts,
    WeatherLookup weather,
    Instant now) {

  public SynthesisContext {
    tasks = tasks != null ? List.copyOf(tasks) : List.of();
    members = members != null ? List.copyOf(members) : List.of();
    invitations = invitations != null ? List.copyOf(invitations) : List.of();
    contracts = contracts != null ? List.copyOf(contracts) : List.of();
    weather = weather != null ? weather : WeatherLookup.NONE;
    now = now != null ? now : Instant.now();
  }

  public static Builder builder(UUID projectId) {
    return new Builder(projectId);
  }

  public static final class Builder {

    private final UUID projectId;
    private String projectTrade;
    private String projectAddress;
    private List<Task> tasks;
    private List<TeamMember> members;
    private List<TeamInvitation> invitations;
    private BigDecimal financialTotal;
    private List<Contract> contracts;
    private WeatherLookup weather;
    private Instant now;

    private Builder(UUID projectId) {
      this.projectId = projectId;
    }

    public Builder projectTrade(String projectTrade) {
      this.projectTrade = projectTrade;
      return this;
    }

    public Builder projectAddress(String projectAddress) {
      this.projectAddress = projectAddress;
      return this;
    }

    public Builder tasks(List<Task> tasks) {
      this.tasks = tasks;
      return this;
    }

    public Builder members(List<TeamMember> members) {
      this.members = members;
      return this;
    }

    public Builder invitations(List<TeamInvitation> invitations) {
      this.invitations = invitations;
      return this;
    }

    public Builder financialTotal(BigDecimal financialTotal) {
      this.financialTotal = financialTotal;
      return this;
    }

    public Builder contracts(List<Contract> contracts) {
      this.contracts = contracts;
      return this;
    }

    public Builder weather(WeatherLookup weather) {
      this.weather = weather;
      return this;
    }

    public Builder now(Instant now) {
      this.now = now;
      return this;
    }

    public SynthesisContext build() {
      return new SynthesisContext(
          projectId,
          projectTrade,
          projectAddress,
          tasks,
          members,
          invitations,
          financialTotal,
          contracts,
          weather,
          now);
    }
  }
}
