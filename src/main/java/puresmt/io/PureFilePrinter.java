// Copyright 2026 The PureSMT Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package puresmt.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.core.PureFile.Slice;

/**
 * Writes syntax trees back out as source text. Operators are always fully
 * parenthesised, so <code>0 + X</code> is written <code>(0 + X)</code>. This
 * is used for proof reports and log output, as well as for comparing trees.
 *
 * @author The PureSMT Project Developers
 */
public class PureFilePrinter {
	private final PrintWriter out;

	public PureFilePrinter(OutputStream output) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
	}

	public void flush() {
		out.flush();
	}

	public void write(PureFile file) {
		for (Decl.FunctionDef d : file.getDeclarations()) {
			writeFunctionDef(d);
			out.println();
		}
		out.flush();
	}

	/**
	 * Unparse an arbitrary item into a string.
	 *
	 * @param item
	 * @return
	 */
	public static String toString(PureFile.Item item) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		PureFilePrinter printer = new PureFilePrinter(bout);
		printer.writeItem(item);
		printer.flush();
		return new String(bout.toByteArray(), StandardCharsets.UTF_8);
	}

	public void writeItem(PureFile.Item item) {
		if (item instanceof Decl.FunctionDef) {
			writeFunctionDef((Decl.FunctionDef) item);
		} else if (item instanceof Decl.Parameter) {
			writeParameter((Decl.Parameter) item);
		} else if (item instanceof Slice) {
			writeSlice((Slice) item);
		} else {
			writeExpression((Expr) item);
		}
	}

	private void writeFunctionDef(Decl.FunctionDef d) {
		for (Expr decorator : d.getDecorators()) {
			out.print("@");
			writeExpression(decorator);
			out.println();
		}
		out.print("def ");
		out.print(d.getName());
		out.print("(");
		writeParameters(d.getParameters());
		out.print(")");
		if (d.getReturns() != null) {
			out.print(" -> ");
			writeExpression(d.getReturns());
		}
		out.println(":");
		out.print("\treturn ");
		writeExpression(d.getBody());
		out.println();
	}

	private void writeParameters(List<Decl.Parameter> parameters) {
		for (int i = 0; i != parameters.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeParameter(parameters.get(i));
		}
	}

	private void writeParameter(Decl.Parameter p) {
		if (p.isStarred()) {
			out.print("*");
		}
		out.print(p.getName());
		if (p.getAnnotation() != null) {
			out.print(": ");
			writeExpression(p.getAnnotation());
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Name) {
			out.print(((Expr.Name) e).get());
		} else if (e instanceof Expr.Number) {
			out.print(((Expr.Number) e).getValue());
		} else if (e instanceof Expr.Constant) {
			out.print(((Expr.Constant) e).getKind().getText());
		} else if (e instanceof Expr.Call) {
			writeCall((Expr.Call) e);
		} else if (e instanceof Expr.BinOp) {
			writeBinOp((Expr.BinOp) e);
		} else if (e instanceof Expr.UnaryOp) {
			writeUnaryOp((Expr.UnaryOp) e);
		} else if (e instanceof Expr.BoolOp) {
			writeBoolOp((Expr.BoolOp) e);
		} else if (e instanceof Expr.Compare) {
			writeCompare((Expr.Compare) e);
		} else if (e instanceof Expr.Subscript) {
			writeSubscript((Expr.Subscript) e);
		} else if (e instanceof Expr.Tuple) {
			writeTuple((Expr.Tuple) e);
		} else if (e instanceof Expr.Starred) {
			out.print("*");
			writeExpression(((Expr.Starred) e).getOperand());
		} else if (e instanceof Expr.Lambda) {
			writeLambda((Expr.Lambda) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeExpressions(List<Expr> exprs) {
		for (int i = 0; i != exprs.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(exprs.get(i));
		}
	}

	private void writeCall(Expr.Call e) {
		writeExpression(e.getCallee());
		out.print("(");
		writeExpressions(e.getArguments());
		out.print(")");
	}

	private void writeBinOp(Expr.BinOp e) {
		out.print("(");
		writeExpression(e.getLeftHandSide());
		out.print(" " + e.getOperator().getSymbol() + " ");
		writeExpression(e.getRightHandSide());
		out.print(")");
	}

	private void writeUnaryOp(Expr.UnaryOp e) {
		out.print("(");
		out.print(e.getOperator().getSymbol());
		if (e.getOperator() == PureFile.Operator.NOT) {
			out.print(" ");
		}
		writeExpression(e.getOperand());
		out.print(")");
	}

	private void writeBoolOp(Expr.BoolOp e) {
		List<Expr> operands = e.getOperands();
		out.print("(");
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(" " + e.getOperator().getSymbol() + " ");
			}
			writeExpression(operands.get(i));
		}
		out.print(")");
	}

	private void writeCompare(Expr.Compare e) {
		out.print("(");
		writeExpression(e.getLeftHandSide());
		for (int i = 0; i != e.getOperators().size(); ++i) {
			out.print(" " + e.getOperators().get(i).getSymbol() + " ");
			writeExpression(e.getComparators().get(i));
		}
		out.print(")");
	}

	private void writeSubscript(Expr.Subscript e) {
		writeExpression(e.getSource());
		out.print("[");
		writeSlice(e.getSlice());
		out.print("]");
	}

	private void writeSlice(Slice s) {
		if (s instanceof Slice.Index) {
			writeExpression(((Slice.Index) s).getIndex());
		} else if (s instanceof Slice.Range) {
			Slice.Range r = (Slice.Range) s;
			if (r.getLower() != null) {
				writeExpression(r.getLower());
			}
			out.print(":");
			if (r.getUpper() != null) {
				writeExpression(r.getUpper());
			}
			if (r.getStep() != null) {
				out.print(":");
				writeExpression(r.getStep());
			}
		} else {
			List<Slice> dimensions = ((Slice.Extended) s).getDimensions();
			for (int i = 0; i != dimensions.size(); ++i) {
				if (i != 0) {
					out.print(", ");
				}
				writeSlice(dimensions.get(i));
			}
		}
	}

	private void writeTuple(Expr.Tuple e) {
		out.print("(");
		writeExpressions(e.getItems());
		if (e.getItems().size() == 1) {
			out.print(",");
		}
		out.print(")");
	}

	private void writeLambda(Expr.Lambda e) {
		out.print("(lambda");
		if (!e.getParameters().isEmpty()) {
			out.print(" ");
			writeParameters(e.getParameters());
		}
		out.print(": ");
		writeExpression(e.getBody());
		out.print(")");
	}
}
