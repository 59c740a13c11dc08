package ca.gc.cra.burndler.application.packaging;

import java.util.Objects;

/**
 * Generates the {@code bin/install.sh} and {@code bin/verify.sh} scripts shipped in every package.
 *
 * @param runtimeDir directory {@code install.sh} copies {@code resources/} into
 * @param graceSeconds seconds {@code install.sh} waits after starting the stack
 * @since 0.1.0
 */
public record InstallerScripts(String runtimeDir, int graceSeconds) {
  public static final String DEFAULT_RUNTIME_DIR = "/var/lib/burndler/resources";
  public static final int DEFAULT_GRACE_SECONDS = 10;

  private static final String INSTALL = """
      #!/bin/bash
      set -e

      echo "Burndler Offline Installer"
      echo "=========================="

      echo "Checking prerequisites..."
      if ! command -v docker &> /dev/null; then
          echo "ERROR: Docker is not installed"
          exit 1
      fi
      if ! command -v docker-compose &> /dev/null; then
          echo "ERROR: Docker Compose is not installed"
          exit 1
      fi

      echo "Loading Docker images..."
      for image in images/*.tar; do
          if [ -f "$image" ]; then
              echo "Loading $image..."
              docker load < "$image"
          fi
      done

      if [ -d "resources" ]; then
          echo "Copying resources..."
          mkdir -p @RUNTIME_DIR@
          cp -r resources/* @RUNTIME_DIR@/
      fi

      if [ ! -f ".env" ]; then
          echo "Creating .env from template..."
          cp env/.env.example .env
          echo "Please edit .env with your configuration"
      fi

      echo "Starting services..."
      (cd compose && docker-compose --env-file ../.env up -d)

      echo "Waiting for services to be healthy..."
      sleep @GRACE_SECONDS@

      echo "Installation complete!"
      """;

  private static final String VERIFY = """
      #!/bin/bash
      set -e

      echo "Burndler Installation Verification"
      echo "=================================="

      echo "Docker version:"
      docker --version

      echo "Docker Compose version:"
      docker-compose --version

      echo "Available disk space:"
      df -h /var/lib/docker || df -h .

      if [ -f "manifest.json" ]; then
          echo "Package manifest:"
          head -20 manifest.json
      fi

      echo "Checking required files..."
      required_files=(
          "compose/docker-compose.yaml"
          "env/.env.example"
          "bin/install.sh"
          "bin/verify.sh"
          "manifest.json"
      )

      for file in "${required_files[@]}"; do
          if [ -f "$file" ]; then
              echo "[ok] $file exists"
          else
              echo "[missing] $file"
          fi
      done

      echo "Verification complete!"
      """;

  public InstallerScripts {
    Objects.requireNonNull(runtimeDir, "runtimeDir");
    if (runtimeDir.isBlank()) {
      throw new IllegalArgumentException("runtimeDir must not be blank");
    }
    if (graceSeconds < 0) {
      throw new IllegalArgumentException("graceSeconds must be >= 0");
    }
  }

  /** Scripts with the stock runtime directory and grace period. */
  public static InstallerScripts defaults() {
    return new InstallerScripts(DEFAULT_RUNTIME_DIR, DEFAULT_GRACE_SECONDS);
  }

  public String install() {
    String dir = runtimeDir.endsWith("/") ? runtimeDir.substring(0, runtimeDir.length() - 1) : runtimeDir;
    return INSTALL.replace("@RUNTIME_DIR@", dir).replace("@GRACE_SECONDS@", Integer.toString(graceSeconds));
  }

  public String verify() {
    return VERIFY;
  }
}
