package io.buildunion.factcore.pendingchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.buildunion.factcore.access.AccessTierResolver;
import io.buildunion.factcore.access.ProjectAccess;
import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.event.PendingChangeCreatedEvent;
import io.buildunion.factcore.event.PendingChangeResolvedEvent;
import io.buildunion.factcore.exception.ForbiddenException;
import io.buildunion.factcore.exception.InvalidStateException;
import io.buildunion.factcore.exception.ResourceConflictException;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import io.buildunion.factcore.project.Project;
import io.buildunion.factcore.project.ProjectRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class PendingChangeServiceTest {

  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final UUID FOREMAN_ID = UUID.randomUUID();
  private static final String ITEM_ID = "drywall-1/2";

  @Mock private PendingChangeRepository pendingChangeRepository;
  @Mock private ProjectRepository projectRepository;
  @Mock private ProjectAccessService projectAccessService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @InjectMocks private PendingChangeService service;

  private final Project project = project();

  @Test
  void foremanCreatesPendingChangeAndOwnerIsNotified() {
    stubProjectAndRole(FOREMAN_ID, "foreman");
    when(pendingChangeRepository.existsPending(
            project.getId(), PendingItemType.MATERIAL, ITEM_ID))
        .thenReturn(false);
    when(pendingChangeRepository.saveAndFlush(any(PendingChange.class)))
        .thenAnswer(invocation -> withId(invocation.getArgument(0)));

    var view = create(FOREMAN_ID);

    assertThat(view.status()).isEqualTo(PendingChangeStatus.PENDING);
    assertThat(view.requestedBy()).isEqualTo(FOREMAN_ID);
    var event = ArgumentCaptor.forClass(PendingChangeCreatedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().ownerMemberId()).isEqualTo(OWNER_ID);
    assertThat(event.getValue().ownerEmail()).isEqualTo("owner@example.com");
    assertThat(event.getValue().eventType()).isEqualTo("pending_change.created");
  }

  @Test
  void secondRequestForSameItemConflicts() {
    stubProjectAndRole(FOREMAN_ID, "foreman");
    when(pendingChangeRepository.existsPending(
            project.getId(), PendingItemType.MATERIAL, ITEM_ID))
        .thenReturn(true);

    assertThatThrownBy(() -> create(FOREMAN_ID))
        .isInstanceOf(ResourceConflictException.class);
    verify(pendingChangeRepository, never()).saveAndFlush(any());
    verify(eventPublisher, never()).publishEvent(any(Object.class));
  }

  @Test
  void concurrentInsertLosingUniqueIndexConflicts() {
    stubProjectAndRole(FOREMAN_ID, "subcontractor");
    when(pendingChangeRepository.existsPending(
            project.getId(), PendingItemType.MATERIAL, ITEM_ID))
        .thenReturn(false);
    when(pendingChangeRepository.saveAndFlush(any(PendingChange.class)))
        .thenThrow(new DataIntegrityViolationException("uq_pending_changes_single_flight"));

    assertThatThrownBy(() -> create(FOREMAN_ID))
        .isInstanceOf(ResourceConflictException.class);
    verify(eventPublisher, never()).publishEvent(any(Object.class));
  }

  @Test
  void workerCannotRequestChange() {
    var workerId = UUID.randomUUID();
    stubProjectAndRole(workerId, "worker");

    assertThatThrownBy(() -> create(workerId)).isInstanceOf(ForbiddenException.class);
    verify(pendingChangeRepository, never()).existsPending(any(), any(), any());
  }

  @Test
  void ownerApprovalReturnsNewQuantity() {
    var change = pending();
    when(projectAccessService.requireOwner(project.getId(), OWNER_ID))
        .thenReturn(access(OWNER_ID, "owner"));
    when(pendingChangeRepository.findById(change.getId())).thenReturn(Optional.of(change));
    when(pendingChangeRepository.save(change)).thenReturn(change);

    var outcome = service.approve(project.getId(), change.getId(), OWNER_ID, "ok");

    assertThat(outcome.newQuantity()).isEqualByComparingTo("55");
    assertThat(outcome.change().status()).isEqualTo(PendingChangeStatus.APPROVED);
    assertThat(outcome.change().resolvedBy()).isEqualTo(OWNER_ID);
    verify(eventPublisher).publishEvent(any(PendingChangeResolvedEvent.class));
  }

  @Test
  void nonOwnerCannotApprove() {
    when(projectAccessService.requireOwner(project.getId(), FOREMAN_ID))
        .thenThrow(new ForbiddenException("Owner access required", "Only the owner"));

    assertThatThrownBy(
            () -> service.approve(project.getId(), UUID.randomUUID(), FOREMAN_ID, null))
        .isInstanceOf(ForbiddenException.class);
    verify(pendingChangeRepository, never()).save(any());
  }

  @Test
  void resolvedChangeCannotBeRejected() {
    var change = pending();
    change.approve(OWNER_ID, null);
    when(projectAccessService.requireOwner(project.getId(), OWNER_ID))
        .thenReturn(access(OWNER_ID, "owner"));
    when(pendingChangeRepository.findById(change.getId())).thenReturn(Optional.of(change));

    assertThatThrownBy(() -> service.reject(project.getId(), change.getId(), OWNER_ID, null))
        .isInstanceOf(InvalidStateException.class);
    assertThat(change.getStatus()).isEqualTo(PendingChangeStatus.APPROVED);
  }

  @Test
  void onlyRequesterCanCancel() {
    var change = pending();
    when(pendingChangeRepository.findById(change.getId())).thenReturn(Optional.of(change));

    assertThatThrownBy(() -> service.cancel(project.getId(), change.getId(), OWNER_ID))
        .isInstanceOf(ForbiddenException.class);
    assertThat(change.getStatus()).isEqualTo(PendingChangeStatus.PENDING);
  }

  @Test
  void requesterCancelsOwnChange() {
    var change = pending();
    when(pendingChangeRepository.findById(change.getId())).thenReturn(Optional.of(change));
    when(pendingChangeRepository.save(change)).thenReturn(change);

    var view = service.cancel(project.getId(), change.getId(), FOREMAN_ID);

    assertThat(view.status()).isEqualTo(PendingChangeStatus.CANCELLED);
  }

  @Test
  void changeFromAnotherProjectIsNotFound() {
    var change = pending();
    when(pendingChangeRepository.findById(change.getId())).thenReturn(Optional.of(change));

    assertThatThrownBy(() -> service.cancel(UUID.randomUUID(), change.getId(), FOREMAN_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void nonOwnerListsOnlyOwnRequests() {
    when(projectAccessService.resolve(project.getId(), FOREMAN_ID))
        .thenReturn(access(FOREMAN_ID, "foreman"));
    when(pendingChangeRepository.findByProjectIdAndRequestedBy(project.getId(), FOREMAN_ID))
        .thenReturn(List.of(pending()));

    var views = service.list(project.getId(), FOREMAN_ID);

    assertThat(views).hasSize(1);
    verify(pendingChangeRepository, never()).findByProjectId(any());
  }

  private PendingChangeView create(UUID requesterId) {
    return service.create(
        project.getId(),
        PendingItemType.MATERIAL,
        ITEM_ID,
        "Drywall 1/2\"",
        new BigDecimal("40"),
        new BigDecimal("55"),
        "Extra wall in basement",
        requesterId);
  }

  private void stubProjectAndRole(UUID memberId, String role) {
    when(projectRepository.findById(project.getId())).thenReturn(Optional.of(project));
    when(projectAccessService.resolve(project, memberId)).thenReturn(access(memberId, role));
  }

  private ProjectAccess access(UUID memberId, String role) {
    return new ProjectAccess(
        project.getId(), memberId, role, AccessTierResolver.tierOf(role), false);
  }

  private PendingChange pending() {
    return withId(
        new PendingChange(
            project.getId(),
            PendingItemType.MATERIAL,
            ITEM_ID,
            "Drywall 1/2\"",
            new BigDecimal("40"),
            new BigDecimal("55"),
            "Extra wall in basement",
            FOREMAN_ID));
  }

  private static PendingChange withId(PendingChange change) {
    ReflectionTestUtils.setField(change, "id", UUID.randomUUID());
    return change;
  }

  private static Project project() {
    var project =
        new Project("Maple Reno", "1 Front St", "renovation", OWNER_ID, "owner@example.com");
    ReflectionTestUtils.setField(project, "id", UUID.randomUUID());
    return project;
  }
}
