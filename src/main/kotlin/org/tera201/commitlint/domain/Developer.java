package org.tera201.commitlint.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Author of a commit. Missing values are kept as empty strings so author
 * filters can match against them.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Developer {

	private final String name;
	private final String email;

	public Developer(String name, String email) {
		this.name = name == null ? "" : name;
		this.email = email == null ? "" : email;
	}

}
