package io.buildunion.factcore.integration.weather;

import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.context.RequestScopes;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import io.buildunion.factcore.project.ProjectRepository;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WeatherController {

  private final WeatherService weatherService;
  private final ProjectRepository projectRepository;
  private final ProjectAccessService projectAccessService;

  public WeatherController(
      WeatherService weatherService,
      ProjectRepository projectRepository,
      ProjectAccessService projectAccessService) {
    this.weatherService = weatherService;
    this.projectRepository = projectRepository;
    this.projectAccessService = projectAccessService;
  }

  @GetMapping("/api/projects/{projectId}/weather")
  public ResponseEntity<WeatherReport> getWeather(@PathVariable UUID projectId) {
    UUID memberId = RequestScopes.requireMemberId();
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    projectAccessService.resolve(project, memberId);
    if (project.getAddress() == null || project.getAddress().isBlank()) {
      throw new ResourceNotFoundException("Project address", projectId);
    }
    return ResponseEntity.ok(weatherService.fetch(project.getAddress()));
  }
}
