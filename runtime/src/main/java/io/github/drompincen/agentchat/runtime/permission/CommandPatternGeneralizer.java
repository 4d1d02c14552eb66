package io.github.drompincen.agentchat.runtime.permission;

import java.util.List;

/**
 * Maps a concrete shell command to the wildcard pattern offered for "always allow".
 * Rules are checked in table order and the first match wins. An empty subcommand
 * matches any second token.
 */
public final class CommandPatternGeneralizer {

    record Rule(String command, String subcommand, String pattern) {

        boolean matches(String first, String second) {
            return command.equals(first) && (subcommand.isEmpty() || subcommand.equals(second));
        }
    }

    private static final List<Rule> RULES = List.of(
            // package managers
            new Rule("npm", "install", "npm install *"),
            new Rule("npm", "i", "npm i *"),
            new Rule("npm", "add", "npm add *"),
            new Rule("npm", "remove", "npm remove *"),
            new Rule("npm", "uninstall", "npm uninstall *"),
            new Rule("npm", "update", "npm update *"),
            new Rule("npm", "run", "npm run *"),
            new Rule("npm", "test", "npm test *"),
            new Rule("npx", "", "npx *"),
            new Rule("yarn", "add", "yarn add *"),
            new Rule("yarn", "remove", "yarn remove *"),
            new Rule("yarn", "install", "yarn install *"),
            new Rule("pnpm", "install", "pnpm install *"),
            new Rule("pnpm", "add", "pnpm add *"),
            new Rule("pnpm", "remove", "pnpm remove *"),
            new Rule("bun", "install", "bun install *"),
            new Rule("bun", "add", "bun add *"),
            // git
            new Rule("git", "add", "git add *"),
            new Rule("git", "commit", "git commit *"),
            new Rule("git", "push", "git push *"),
            new Rule("git", "pull", "git pull *"),
            new Rule("git", "checkout", "git checkout *"),
            new Rule("git", "branch", "git branch *"),
            new Rule("git", "merge", "git merge *"),
            new Rule("git", "clone", "git clone *"),
            new Rule("git", "reset", "git reset *"),
            new Rule("git", "rebase", "git rebase *"),
            new Rule("git", "tag", "git tag *"),
            new Rule("git", "status", "git status"),
            new Rule("git", "diff", "git diff *"),
            new Rule("git", "log", "git log *"),
            // docker
            new Rule("docker", "run", "docker run *"),
            new Rule("docker", "build", "docker build *"),
            new Rule("docker", "exec", "docker exec *"),
            new Rule("docker", "logs", "docker logs *"),
            new Rule("docker", "stop", "docker stop *"),
            new Rule("docker", "start", "docker start *"),
            new Rule("docker", "rm", "docker rm *"),
            new Rule("docker", "rmi", "docker rmi *"),
            new Rule("docker", "pull", "docker pull *"),
            new Rule("docker", "push", "docker push *"),
            // build tools
            new Rule("make", "", "make *"),
            new Rule("cargo", "build", "cargo build *"),
            new Rule("cargo", "run", "cargo run *"),
            new Rule("cargo", "test", "cargo test *"),
            new Rule("cargo", "install", "cargo install *"),
            new Rule("mvn", "compile", "mvn compile *"),
            new Rule("mvn", "test", "mvn test *"),
            new Rule("mvn", "package", "mvn package *"),
            new Rule("gradle", "build", "gradle build *"),
            new Rule("gradle", "test", "gradle test *"),
            new Rule("go", "build", "go build *"),
            new Rule("go", "test", "go test *"),
            // system tools
            new Rule("curl", "", "curl *"),
            new Rule("wget", "", "wget *"),
            new Rule("ssh", "", "ssh *"),
            new Rule("scp", "", "scp *"),
            new Rule("rsync", "", "rsync *"),
            new Rule("tar", "", "tar *"),
            new Rule("zip", "", "zip *"),
            new Rule("unzip", "", "unzip *"),
            new Rule("mkdir", "", "mkdir *"),
            new Rule("cat", "", "cat *"),
            new Rule("ls", "", "ls *"),
            new Rule("cd", "", "cd *"),
            // development tools
            new Rule("node", "", "node *"),
            new Rule("python", "", "python *"),
            new Rule("python3", "", "python3 *"),
            new Rule("pip", "install", "pip install *"),
            new Rule("pip3", "install", "pip3 install *"),
            new Rule("composer", "install", "composer install *"),
            new Rule("composer", "require", "composer require *"),
            new Rule("bundle", "install", "bundle install *"),
            new Rule("gem", "install", "gem install *"));

    private CommandPatternGeneralizer() {}

    public static String generalize(String command) {
        String[] tokens = command == null ? new String[0] : command.trim().split("\\s+");
        if (tokens.length == 0 || tokens[0].isEmpty()) {
            return "";
        }
        String first = tokens[0];
        String second = tokens.length > 1 ? tokens[1] : "";
        for (Rule rule : RULES) {
            if (rule.matches(first, second)) {
                return rule.pattern();
            }
        }
        return tokens.length > 1 ? first + " *" : first;
    }
}
