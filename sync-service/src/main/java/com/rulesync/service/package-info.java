/**
 * Runnable rule-sync service: environment and file configuration, the
 * git-sync supervisor, directory-backed downstream channels, the status
 * server and the scheduler that drives the reconcile controller.
 */
package com.rulesync.service;
