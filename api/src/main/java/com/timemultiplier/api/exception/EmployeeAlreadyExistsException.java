package com.timemultiplier.api.exception;

/** Registering an employee id that is already in the registry. Reported as a bad request. */
public class EmployeeAlreadyExistsException extends IllegalArgumentException {

  public EmployeeAlreadyExistsException(String employeeId) {
    super("Employee already exists: " + employeeId);
  }
}
