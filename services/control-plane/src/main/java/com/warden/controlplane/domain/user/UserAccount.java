package com.warden.controlplane.domain.user;

import com.warden.database.model.Project;
import com.warden.database.model.User;
import com.warden.database.model.UserRoleBinding;
import java.util.List;

/** A user with the projects and roles they hold. */
public record UserAccount(User user, List<Project> projects, List<UserRoleBinding> roles) {}
