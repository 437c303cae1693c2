package com.fabtrack.api.subtask;

import com.fabtrack.api.activity.ActivityLogService;
import com.fabtrack.api.activity.ActivityType;
import com.fabtrack.api.activity.ResourceType;
import com.fabtrack.api.subtask.dto.CreateSubtaskRequest;
import com.fabtrack.api.subtask.dto.SubtaskDto;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class SubtaskService {

  private final SubtaskRepository repo;
  private final ActivityLogService activityLog;

  public SubtaskDto create(CreateSubtaskRequest req) {
    long id = repo.insert(req.title().trim(), req.statusOrDefault(), req.projectId(), req.categoryTaskId(),
        req.category());
    activityLog.record(ActivityType.CREATE, ResourceType.SUBTASK, id, "Created sub-task: " + req.title(),
        Map.of("categoryTaskId", req.categoryTaskId()));
    return repo.findById(id).orElseThrow(SubtaskNotFoundException::new);
  }

  public List<SubtaskDto> listAll() {
    return repo.listAll();
  }

  public List<SubtaskDto> listByTask(long taskId, String category) {
    return repo.listByTask(taskId, category);
  }

  public SubtaskDto markDone(long id) {
    if (repo.markDone(id) == 0) {
      throw new SubtaskNotFoundException();
    }
    return repo.findById(id).orElseThrow(SubtaskNotFoundException::new);
  }

  public void delete(long id) {
    if (repo.delete(id) == 0) {
      throw new SubtaskNotFoundException();
    }
    activityLog.record(ActivityType.DELETE, ResourceType.SUBTASK, id, "Deleted sub-task " + id, Map.of());
  }
}
